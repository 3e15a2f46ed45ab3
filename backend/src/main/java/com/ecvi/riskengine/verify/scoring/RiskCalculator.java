package com.ecvi.riskengine.verify.scoring;

import com.ecvi.riskengine.verify.model.ConfidenceSummary;
import com.ecvi.riskengine.verify.model.RiskAssessment;
import com.ecvi.riskengine.verify.model.RiskCategory;
import com.ecvi.riskengine.verify.model.RiskContribution;
import com.ecvi.riskengine.verify.model.RiskFactor;
import com.ecvi.riskengine.verify.model.SourceCategory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Weighted 0-100 risk score. Each factor contributes {@code weight x (1 - confidence) x 100};
 * missing categories keep their full weight rather than being renormalized away.
 */
@Component
public class RiskCalculator {

    public RiskAssessment score(ConfidenceSummary summary) {
        Map<RiskFactor, RiskContribution> breakdown = new EnumMap<>(RiskFactor.class);
        double total = 0.0;
        for (RiskFactor factor : RiskFactor.values()) {
            double confidence = confidenceFor(factor, summary);
            double contribution = factor.weight() * (1.0 - confidence) * 100.0;
            breakdown.put(factor, new RiskContribution(factor.weight(), confidence, contribution));
            total += contribution;
        }
        int riskScore = (int) Math.max(0, Math.min(100, Math.round(total)));
        return new RiskAssessment(riskScore, RiskCategory.fromScore(riskScore), breakdown);
    }

    private double confidenceFor(RiskFactor factor, ConfidenceSummary summary) {
        double value = switch (factor) {
            case DNS -> summary.confidence(SourceCategory.DNS);
            case REGISTRATION -> summary.confidence(SourceCategory.REGISTRATION);
            case CONTACT -> summary.confidence(SourceCategory.CONTACT);
            case DOMAIN_AUTHENTICITY -> summary.domainAuthenticity();
            case CROSS_SOURCE_CONSISTENCY -> summary.crossSourceConsistency();
        };
        return Math.max(0.0, Math.min(1.0, value));
    }
}

package com.ecvi.riskengine.verify.scoring;

import com.ecvi.riskengine.verify.adapter.ReportedFields;
import com.ecvi.riskengine.verify.model.ConfidenceSummary;
import com.ecvi.riskengine.verify.model.Discrepancy;
import com.ecvi.riskengine.verify.model.DiscrepancySeverity;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

@Component
public class ConfidenceScorer {
    static final double NAME_MISMATCH_FACTOR = 0.8;
    static final double INVALID_CERTIFICATE_FACTOR = 0.7;

    /** Returns the results with {@code confidence} filled in per category. */
    public Map<SourceCategory, SourceResult> assignConfidence(Map<SourceCategory, SourceResult> results) {
        Map<SourceCategory, SourceResult> scored = new EnumMap<>(SourceCategory.class);
        for (Map.Entry<SourceCategory, SourceResult> entry : results.entrySet()) {
            scored.put(entry.getKey(), entry.getValue().withConfidence(categoryConfidence(entry.getValue())));
        }
        return scored;
    }

    public ConfidenceSummary summarize(Map<SourceCategory, SourceResult> scoredResults) {
        Map<SourceCategory, Double> confidences = new EnumMap<>(SourceCategory.class);
        for (SourceCategory category : SourceCategory.values()) {
            SourceResult result = scoredResults.get(category);
            confidences.put(category, result == null ? 0.0 : result.confidence());
        }
        return new ConfidenceSummary(
            confidences,
            domainAuthenticity(confidences, scoredResults.get(SourceCategory.DNS)),
            crossSourceConsistency(scoredResults.values())
        );
    }

    /**
     * signal x corroboration factor, minus a penalty per discrepancy. Anything other than an
     * evaluated result is exactly 0.
     */
    public double categoryConfidence(SourceResult result) {
        if (result == null || !result.hasEvidence()) {
            return 0.0;
        }
        double confidence = result.signal() * corroborationFactor(result.corroboratingSources());
        for (Discrepancy discrepancy : result.discrepancies()) {
            confidence -= categoryPenalty(discrepancy.severity());
        }
        return clamp(confidence);
    }

    /**
     * mean(DNS, registration) scaled down when the domain does not look like the company's own:
     * a label unrelated to the legal name, a certificate that fails validation, or a recently
     * registered domain. Facts the DNS adapter could not establish leave the score unchanged.
     */
    double domainAuthenticity(Map<SourceCategory, Double> confidences, SourceResult dnsResult) {
        double combined = (confidences.get(SourceCategory.DNS) + confidences.get(SourceCategory.REGISTRATION)) / 2.0;
        if (dnsResult == null || !dnsResult.hasEvidence()) {
            return clamp(combined * NAME_MISMATCH_FACTOR);
        }
        double factor = Boolean.parseBoolean(dnsResult.field(ReportedFields.DOMAIN_MATCHES_NAME))
            ? 1.0
            : NAME_MISMATCH_FACTOR;
        if ("false".equals(dnsResult.field(ReportedFields.SSL_VALID))) {
            factor *= INVALID_CERTIFICATE_FACTOR;
        }
        factor *= domainAgeFactor(dnsResult.field(ReportedFields.DOMAIN_AGE_DAYS));
        return clamp(combined * factor);
    }

    static double domainAgeFactor(String ageDays) {
        if (ageDays == null) {
            return 1.0;
        }
        long days;
        try {
            days = Long.parseLong(ageDays.trim());
        } catch (NumberFormatException e) {
            return 1.0;
        }
        if (days < 30) {
            return 0.6;
        }
        if (days < 90) {
            return 0.75;
        }
        if (days < 365) {
            return 0.9;
        }
        return 1.0;
    }

    double crossSourceConsistency(Collection<SourceResult> results) {
        double consistency = 1.0;
        for (SourceResult result : results) {
            for (Discrepancy discrepancy : result.discrepancies()) {
                consistency -= consistencyPenalty(discrepancy.severity());
            }
        }
        return clamp(consistency);
    }

    static double corroborationFactor(int sources) {
        if (sources <= 0) {
            return 0.5;
        }
        if (sources == 1) {
            return 0.75;
        }
        if (sources == 2) {
            return 0.9;
        }
        return 1.0;
    }

    private static double categoryPenalty(DiscrepancySeverity severity) {
        return switch (severity) {
            case HIGH -> 0.25;
            case MEDIUM -> 0.10;
            case LOW -> 0.03;
        };
    }

    private static double consistencyPenalty(DiscrepancySeverity severity) {
        return switch (severity) {
            case HIGH -> 0.35;
            case MEDIUM -> 0.15;
            case LOW -> 0.05;
        };
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}

package com.ecvi.riskengine.verify.model;

import java.util.Map;

public record RiskAssessment(int riskScore, RiskCategory riskCategory, Map<RiskFactor, RiskContribution> breakdown) {

    public double contributionTotal() {
        double total = 0.0;
        for (RiskContribution contribution : breakdown.values()) {
            total += contribution.contribution();
        }
        return total;
    }
}

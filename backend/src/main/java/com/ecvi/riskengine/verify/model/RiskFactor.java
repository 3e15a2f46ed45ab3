package com.ecvi.riskengine.verify.model;

/**
 * Weighted risk categories. The weights are product-chosen constants and sum to 100.
 */
public enum RiskFactor {
    DNS(25),
    REGISTRATION(25),
    CONTACT(20),
    DOMAIN_AUTHENTICITY(15),
    CROSS_SOURCE_CONSISTENCY(15);

    private final int weightPercent;

    RiskFactor(int weightPercent) {
        this.weightPercent = weightPercent;
    }

    public int weightPercent() {
        return weightPercent;
    }

    public double weight() {
        return weightPercent / 100.0;
    }
}

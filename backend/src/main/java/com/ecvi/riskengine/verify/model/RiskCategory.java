package com.ecvi.riskengine.verify.model;

public enum RiskCategory {
    LOW,
    MEDIUM,
    HIGH;

    /** Bands are inclusive: 0-30 LOW, 31-70 MEDIUM, 71-100 HIGH. */
    public static RiskCategory fromScore(int score) {
        if (score <= 30) {
            return LOW;
        }
        if (score <= 70) {
            return MEDIUM;
        }
        return HIGH;
    }
}

package com.ecvi.riskengine.verify.model;

import java.util.Map;

/**
 * Scorer output: per-category confidence plus the two derived signals used by the
 * risk calculator.
 */
public record ConfidenceSummary(
    Map<SourceCategory, Double> categoryConfidence,
    double domainAuthenticity,
    double crossSourceConsistency
) {
    public double confidence(SourceCategory category) {
        Double value = categoryConfidence.get(category);
        return value == null ? 0.0 : value;
    }
}

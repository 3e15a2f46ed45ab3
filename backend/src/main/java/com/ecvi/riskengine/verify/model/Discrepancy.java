package com.ecvi.riskengine.verify.model;

public record Discrepancy(
    String field,
    String expectedValue,
    String observedValue,
    String source,
    DiscrepancySeverity severity
) {}

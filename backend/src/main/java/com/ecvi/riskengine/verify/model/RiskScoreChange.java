package com.ecvi.riskengine.verify.model;

import java.time.Instant;

/**
 * Step between two consecutive completed records. {@code changePercentage} is relative to
 * {@code fromScore}, rounded to two decimals, and 0 when {@code fromScore} is 0.
 */
public record RiskScoreChange(
    long fromRecordId,
    long toRecordId,
    int fromScore,
    int toScore,
    int change,
    double changePercentage,
    Instant at
) {}

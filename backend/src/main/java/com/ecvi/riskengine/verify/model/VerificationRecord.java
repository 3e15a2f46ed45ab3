package com.ecvi.riskengine.verify.model;

import java.time.Instant;
import java.util.Map;

public record VerificationRecord(
    long id,
    long companyId,
    VerificationStatus status,
    Integer riskScore,
    RiskCategory riskCategory,
    String triggerReason,
    Map<String, String> overrides,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String failureReason,
    Map<SourceCategory, SourceResult> sourceResults,
    Map<RiskFactor, RiskContribution> breakdown,
    Instant tombstonedAt
) {
    public boolean isTombstoned() {
        return tombstonedAt != null;
    }
}

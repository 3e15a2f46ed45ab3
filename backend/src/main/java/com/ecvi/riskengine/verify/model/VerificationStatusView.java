package com.ecvi.riskengine.verify.model;

import java.time.Instant;

public record VerificationStatusView(
    long recordId,
    long companyId,
    VerificationStatus status,
    Integer riskScore,
    RiskCategory riskCategory,
    Instant startedAt,
    Instant completedAt,
    String failureReason) {}

package com.ecvi.riskengine.verify.model;

public record VerificationStatusChangedEvent(
    long companyId,
    long recordId,
    VerificationStatus oldStatus,
    VerificationStatus newStatus) {}

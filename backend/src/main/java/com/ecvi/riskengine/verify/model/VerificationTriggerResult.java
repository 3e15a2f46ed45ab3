package com.ecvi.riskengine.verify.model;

public record VerificationTriggerResult(long recordId, long companyId, VerificationStatus status) {}

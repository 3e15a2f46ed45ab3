package com.ecvi.riskengine.verify.model;

import java.time.Instant;

public record ApprovedCorrection(long companyId, String field, String newValue, Instant approvedAt) {}

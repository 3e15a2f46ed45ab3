package com.ecvi.riskengine.verify.model;

public enum DiscrepancySeverity {
    LOW,
    MEDIUM,
    HIGH
}

package com.ecvi.riskengine.verify.api;

public record VerificationCancelRequest(String reason) {
}

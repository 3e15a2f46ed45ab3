package com.ecvi.riskengine.verify.api;

import java.util.Map;

public record VerificationTriggerRequest(
    Map<String, String> overrides,
    String reason
) {
}

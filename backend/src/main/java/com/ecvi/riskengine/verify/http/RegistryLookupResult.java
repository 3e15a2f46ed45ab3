package com.ecvi.riskengine.verify.http;

public record RegistryLookupResult(
    boolean found,
    String name,
    String companyNumber,
    String jurisdictionCode,
    String currentStatus
) {
    public static RegistryLookupResult notFound() {
        return new RegistryLookupResult(false, null, null, null, null);
    }
}

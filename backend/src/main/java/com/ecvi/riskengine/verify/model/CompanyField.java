package com.ecvi.riskengine.verify.model;

import java.util.Locale;

public enum CompanyField {
    LEGAL_NAME("legal_name"),
    REGISTRATION_NUMBER("registration_number"),
    JURISDICTION("jurisdiction"),
    DOMAIN("domain"),
    EMAIL("email"),
    PHONE("phone"),
    ADDRESS_STREET("address_street"),
    ADDRESS_CITY("address_city"),
    ADDRESS_STATE("address_state"),
    ADDRESS_POSTAL_CODE("address_postal_code"),
    ADDRESS_COUNTRY("address_country");

    private final String key;

    CompanyField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static CompanyField fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("field is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CompanyField field : values()) {
            if (field.key.equals(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown company field: " + raw);
    }
}

package com.ecvi.riskengine.verify.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of a company as handed to the engine, optionally with approved
 * corrections or caller overrides already applied.
 */
public record CompanySnapshot(
    long companyId,
    String legalName,
    String registrationNumber,
    String jurisdiction,
    String domain,
    String email,
    String phone,
    String addressStreet,
    String addressCity,
    String addressState,
    String addressPostalCode,
    String addressCountry
) {
    public String value(CompanyField field) {
        return switch (field) {
            case LEGAL_NAME -> legalName;
            case REGISTRATION_NUMBER -> registrationNumber;
            case JURISDICTION -> jurisdiction;
            case DOMAIN -> domain;
            case EMAIL -> email;
            case PHONE -> phone;
            case ADDRESS_STREET -> addressStreet;
            case ADDRESS_CITY -> addressCity;
            case ADDRESS_STATE -> addressState;
            case ADDRESS_POSTAL_CODE -> addressPostalCode;
            case ADDRESS_COUNTRY -> addressCountry;
        };
    }

    public boolean hasValue(CompanyField field) {
        String value = value(field);
        return value != null && !value.isBlank();
    }

    /**
     * Returns a copy with the given field values replaced. Keys are {@link CompanyField}
     * keys; a blank value clears an optional field.
     */
    public CompanySnapshot withOverrides(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<CompanyField, String> values = new LinkedHashMap<>();
        for (CompanyField field : CompanyField.values()) {
            values.put(field, value(field));
        }
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            CompanyField field = CompanyField.fromKey(entry.getKey());
            String value = entry.getValue() == null ? null : entry.getValue().trim();
            if (value != null && value.isEmpty()) {
                value = null;
            }
            if (field == CompanyField.LEGAL_NAME && value == null) {
                throw new IllegalArgumentException("legal_name cannot be cleared");
            }
            values.put(field, value);
        }
        return new CompanySnapshot(
            companyId,
            values.get(CompanyField.LEGAL_NAME),
            values.get(CompanyField.REGISTRATION_NUMBER),
            values.get(CompanyField.JURISDICTION),
            values.get(CompanyField.DOMAIN),
            values.get(CompanyField.EMAIL),
            values.get(CompanyField.PHONE),
            values.get(CompanyField.ADDRESS_STREET),
            values.get(CompanyField.ADDRESS_CITY),
            values.get(CompanyField.ADDRESS_STATE),
            values.get(CompanyField.ADDRESS_POSTAL_CODE),
            values.get(CompanyField.ADDRESS_COUNTRY)
        );
    }
}

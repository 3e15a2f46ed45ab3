package com.ecvi.riskengine.verify.adapter;

import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Completeness of the postal address. No geocoding is performed, so a complete but
 * fictitious address scores the same as a real one.
 */
@Component
public class AddressAdapter implements SourceAdapter {
    private static final Set<CompanyField> ADDRESS_FIELDS = new LinkedHashSet<>(List.of(
        CompanyField.ADDRESS_STREET,
        CompanyField.ADDRESS_CITY,
        CompanyField.ADDRESS_STATE,
        CompanyField.ADDRESS_POSTAL_CODE,
        CompanyField.ADDRESS_COUNTRY
    ));
    private static final Set<String> ISO_COUNTRIES = Set.of(Locale.getISOCountries());

    @Override
    public SourceCategory category() {
        return SourceCategory.ADDRESS;
    }

    @Override
    public Set<CompanyField> inputFields() {
        return ADDRESS_FIELDS;
    }

    @Override
    public SourceResult evaluate(CompanySnapshot snapshot, Instant deadline) {
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, Double> fieldConfidence = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        int validCount = 0;
        for (CompanyField field : ADDRESS_FIELDS) {
            if (!snapshot.hasValue(field)) {
                notes.add("missing_" + field.key());
                continue;
            }
            String value = snapshot.value(field).trim();
            if (isValid(field, value)) {
                validCount++;
                fieldConfidence.put(field.key(), 1.0);
            } else {
                notes.add("invalid_" + field.key());
                fieldConfidence.put(field.key(), 0.0);
            }
        }
        if (snapshot.hasValue(CompanyField.ADDRESS_COUNTRY)) {
            String country = snapshot.addressCountry().trim().toUpperCase(Locale.ROOT);
            if (ISO_COUNTRIES.contains(country)) {
                fields.put(ReportedFields.COUNTRY, country);
            }
        }
        double completeness = validCount / (double) ADDRESS_FIELDS.size();
        fields.put(ReportedFields.ADDRESS_COMPLETENESS, String.format(Locale.ROOT, "%.2f", completeness));
        return SourceResult.evaluated(category(), fields, fieldConfidence, completeness, 1, List.of(), notes);
    }

    static boolean isValid(CompanyField field, String value) {
        return switch (field) {
            case ADDRESS_STREET -> value.length() >= 5;
            case ADDRESS_POSTAL_CODE -> value.length() >= 3 && value.length() <= 20;
            case ADDRESS_COUNTRY -> ISO_COUNTRIES.contains(value.toUpperCase(Locale.ROOT));
            default -> !value.isBlank();
        };
    }
}

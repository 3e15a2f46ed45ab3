package com.ecvi.riskengine.verify.adapter;

import com.ecvi.riskengine.verify.http.AdapterUnavailableException;
import com.ecvi.riskengine.verify.http.RegistryClient;
import com.ecvi.riskengine.verify.http.RegistryLookupResult;
import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import com.ecvi.riskengine.verify.model.Discrepancy;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceResult;
import com.ecvi.riskengine.verify.scoring.FieldComparator;
import com.ecvi.riskengine.verify.scoring.FieldKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class RegistrationAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(RegistrationAdapter.class);

    static final String REGISTRY_SOURCE = "registry";
    static final double REGISTRY_CONFIRMED_SIGNAL = 1.0;
    static final double REGISTRY_INACTIVE_SIGNAL = 0.5;
    static final double FORMAT_ONLY_SIGNAL = 0.3;
    static final double REGISTRY_NO_MATCH_SIGNAL = 0.15;

    private static final Pattern GENERIC_FORMAT = Pattern.compile("^[A-Z0-9\\-/]+$");
    private static final Map<String, Pattern> JURISDICTION_FORMATS = Map.of(
        "gb", Pattern.compile("^(\\d{8}|[A-Z]{2}\\d{6})$"),
        "us", Pattern.compile("^(\\d{2}-?\\d{7}|[A-Z]?\\d{6,10})$"),
        "ie", Pattern.compile("^\\d{5,6}$"),
        "nl", Pattern.compile("^\\d{8}$"),
        "fr", Pattern.compile("^(\\d{9}|\\d{14})$"),
        "de", Pattern.compile("^HR[AB]\\d{1,6}[A-Z]?$"),
        "ca", Pattern.compile("^(\\d{7}|\\d{9}([A-Z]{2}\\d{4})?)$"),
        "au", Pattern.compile("^(\\d{9}|\\d{11})$")
    );
    private static final List<String> INACTIVE_STATUS_MARKERS =
        List.of("dissolved", "liquidation", "struck off", "inactive", "removed");

    private final RegistryClient registryClient;

    public RegistrationAdapter(RegistryClient registryClient) {
        this.registryClient = registryClient;
    }

    @Override
    public SourceCategory category() {
        return SourceCategory.REGISTRATION;
    }

    @Override
    public Set<CompanyField> inputFields() {
        return Set.of(CompanyField.REGISTRATION_NUMBER);
    }

    @Override
    public SourceResult evaluate(CompanySnapshot snapshot, Instant deadline) {
        String number = normalizeNumber(snapshot.registrationNumber());
        String jurisdiction = normalizeJurisdiction(snapshot.jurisdiction());
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, Double> fieldConfidence = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        fields.put(ReportedFields.REGISTRATION_NUMBER, number);
        if (jurisdiction != null) {
            fields.put(ReportedFields.JURISDICTION, jurisdiction);
            fields.put(ReportedFields.COUNTRY, countryOf(jurisdiction));
        }

        if (!isValidFormat(number, jurisdiction)) {
            notes.add("invalid_registration_format");
            fieldConfidence.put(ReportedFields.REGISTRATION_NUMBER, 0.0);
            return SourceResult.evaluated(category(), fields, fieldConfidence, 0.0, 0, List.of(), notes);
        }
        fieldConfidence.put(ReportedFields.REGISTRATION_NUMBER, FORMAT_ONLY_SIGNAL);

        if (jurisdiction == null || !registryClient.isConfigured()) {
            notes.add(jurisdiction == null ? "registry_unavailable: jurisdiction missing" : "registry_unavailable: not configured");
            return SourceResult.evaluated(category(), fields, fieldConfidence, FORMAT_ONLY_SIGNAL, 1, List.of(), notes);
        }

        RegistryLookupResult lookup;
        try {
            lookup = registryClient.lookup(jurisdiction, number, deadline);
        } catch (AdapterUnavailableException e) {
            log.warn("Registry lookup unavailable for company {}: {}", snapshot.companyId(), e.getMessage());
            notes.add("registry_unavailable: " + e.getMessage());
            return SourceResult.evaluated(category(), fields, fieldConfidence, FORMAT_ONLY_SIGNAL, 1, List.of(), notes);
        }

        if (!lookup.found()) {
            notes.add("registry_no_match");
            fieldConfidence.put(ReportedFields.REGISTRATION_NUMBER, REGISTRY_NO_MATCH_SIGNAL);
            return SourceResult.evaluated(
                category(), fields, fieldConfidence, REGISTRY_NO_MATCH_SIGNAL, 1, List.of(), notes
            );
        }

        List<Discrepancy> discrepancies = new ArrayList<>();
        FieldComparator.compare(
            ReportedFields.LEGAL_NAME, FieldKind.NAME, snapshot.legalName(), lookup.name(), REGISTRY_SOURCE
        ).ifPresent(discrepancies::add);
        FieldComparator.compare(
            ReportedFields.REGISTRATION_NUMBER, FieldKind.IDENTIFIER, number, lookup.companyNumber(), REGISTRY_SOURCE
        ).ifPresent(discrepancies::add);
        FieldComparator.compare(
            ReportedFields.JURISDICTION, FieldKind.JURISDICTION, jurisdiction, lookup.jurisdictionCode(), REGISTRY_SOURCE
        ).ifPresent(discrepancies::add);

        putIfPresent(fields, ReportedFields.LEGAL_NAME, lookup.name());
        putIfPresent(fields, ReportedFields.REGISTRATION_NUMBER, lookup.companyNumber());
        if (lookup.jurisdictionCode() != null) {
            String registryJurisdiction = normalizeJurisdiction(lookup.jurisdictionCode());
            fields.put(ReportedFields.JURISDICTION, registryJurisdiction);
            fields.put(ReportedFields.COUNTRY, countryOf(registryJurisdiction));
        }
        putIfPresent(fields, ReportedFields.REGISTRY_STATUS, lookup.currentStatus());

        double signal = REGISTRY_CONFIRMED_SIGNAL;
        if (isInactive(lookup.currentStatus())) {
            notes.add("registry_status_inactive");
            signal = REGISTRY_INACTIVE_SIGNAL;
        }
        fieldConfidence.put(ReportedFields.REGISTRATION_NUMBER, signal);
        fieldConfidence.put(ReportedFields.LEGAL_NAME, signal);
        return SourceResult.evaluated(category(), fields, fieldConfidence, signal, 2, discrepancies, notes);
    }

    static boolean isValidFormat(String number, String jurisdiction) {
        if (number == null || number.isBlank() || !GENERIC_FORMAT.matcher(number).matches()) {
            return false;
        }
        if (jurisdiction == null) {
            return true;
        }
        Pattern pattern = JURISDICTION_FORMATS.get(countryOf(jurisdiction).toLowerCase(Locale.ROOT));
        return pattern == null || pattern.matcher(number).matches();
    }

    static String normalizeNumber(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    static String normalizeJurisdiction(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    /** {@code us_de} gives {@code US}. */
    static String countryOf(String jurisdiction) {
        int idx = jurisdiction.indexOf('_');
        String country = idx < 0 ? jurisdiction : jurisdiction.substring(0, idx);
        return country.toUpperCase(Locale.ROOT);
    }

    private boolean isInactive(String status) {
        if (status == null) {
            return false;
        }
        String lower = status.toLowerCase(Locale.ROOT);
        for (String marker : INACTIVE_STATUS_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private void putIfPresent(Map<String, String> fields, String key, String value) {
        if (value != null && !value.isBlank()) {
            fields.put(key, value);
        }
    }
}

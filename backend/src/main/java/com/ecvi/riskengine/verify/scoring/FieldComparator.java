package com.ecvi.riskengine.verify.scoring;

import com.ecvi.riskengine.verify.model.Discrepancy;
import com.ecvi.riskengine.verify.model.DiscrepancySeverity;
import com.ecvi.riskengine.verify.util.CompanyNames;
import com.ecvi.riskengine.verify.util.DomainNames;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compares two values of the same logical field. Values equal after normalization produce
 * no discrepancy; otherwise the severity reflects how deep the difference goes.
 */
public final class FieldComparator {

    private FieldComparator() {
    }

    public static Optional<Discrepancy> compare(
        String field,
        FieldKind kind,
        String expected,
        String observed,
        String source
    ) {
        return severity(kind, expected, observed)
            .map(severity -> new Discrepancy(field, expected, observed, source, severity));
    }

    /** Empty when either side is missing or both normalize to the same value. */
    public static Optional<DiscrepancySeverity> severity(FieldKind kind, String expected, String observed) {
        if (isBlank(expected) || isBlank(observed)) {
            return Optional.empty();
        }
        if (CompanyNames.basicNormalize(expected).equals(CompanyNames.basicNormalize(observed))) {
            return Optional.empty();
        }
        return Optional.ofNullable(switch (kind) {
            case NAME -> nameSeverity(expected, observed);
            case IDENTIFIER -> identifierSeverity(expected, observed);
            case DOMAIN -> domainSeverity(expected, observed);
            case JURISDICTION -> jurisdictionSeverity(expected, observed);
        });
    }

    private static DiscrepancySeverity nameSeverity(String expected, String observed) {
        if (CompanyNames.suffixCanonical(expected).equals(CompanyNames.suffixCanonical(observed))) {
            return null;
        }
        Set<String> expectedCore = new HashSet<>(CompanyNames.coreTokens(expected));
        Set<String> observedCore = new HashSet<>(CompanyNames.coreTokens(observed));
        if (!expectedCore.isEmpty() && expectedCore.equals(observedCore)) {
            return DiscrepancySeverity.MEDIUM;
        }
        Set<String> expectedExpanded = new HashSet<>(CompanyNames.expandedCoreTokens(expected));
        Set<String> observedExpanded = new HashSet<>(CompanyNames.expandedCoreTokens(observed));
        if (!expectedExpanded.isEmpty() && expectedExpanded.equals(observedExpanded)) {
            return DiscrepancySeverity.LOW;
        }
        return DiscrepancySeverity.HIGH;
    }

    private static DiscrepancySeverity identifierSeverity(String expected, String observed) {
        if (alphanumeric(expected).equals(alphanumeric(observed))) {
            return DiscrepancySeverity.MEDIUM;
        }
        return DiscrepancySeverity.HIGH;
    }

    private static DiscrepancySeverity domainSeverity(String expected, String observed) {
        String expectedHost = DomainNames.normalizeHost(expected);
        String observedHost = DomainNames.normalizeHost(observed);
        if (Objects.equals(expectedHost, observedHost)) {
            return null;
        }
        String expectedRegistrable = DomainNames.registrableDomain(expectedHost);
        if (expectedRegistrable != null && expectedRegistrable.equals(DomainNames.registrableDomain(observedHost))) {
            return DiscrepancySeverity.MEDIUM;
        }
        return DiscrepancySeverity.HIGH;
    }

    private static DiscrepancySeverity jurisdictionSeverity(String expected, String observed) {
        String[] expectedParts = jurisdictionParts(expected);
        String[] observedParts = jurisdictionParts(observed);
        if (!expectedParts[0].equals(observedParts[0])) {
            return DiscrepancySeverity.HIGH;
        }
        if (expectedParts[1].equals(observedParts[1])) {
            return null;
        }
        return DiscrepancySeverity.MEDIUM;
    }

    /** {@code us_de} gives {@code [us, de]}; {@code GB} gives {@code [gb, ""]}. */
    static String[] jurisdictionParts(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        int idx = normalized.indexOf('_');
        String country = idx < 0 ? normalized : normalized.substring(0, idx);
        String subdivision = idx < 0 ? "" : normalized.substring(idx + 1);
        if (country.equals("uk")) {
            country = "gb";
        }
        return new String[] {country, subdivision};
    }

    private static String alphanumeric(String value) {
        return value.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

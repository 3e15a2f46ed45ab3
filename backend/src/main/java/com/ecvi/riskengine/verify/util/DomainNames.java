package com.ecvi.riskengine.verify.util;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class DomainNames {
    private static final Pattern DOMAIN_SYNTAX =
        Pattern.compile("^([a-z0-9]([a-z0-9\\-]{0,61}[a-z0-9])?\\.)+[a-z]{2,}$");

    // Second-level public suffixes common enough to matter for registrable-domain checks.
    private static final Set<String> SECOND_LEVEL_SUFFIXES = Set.of(
        "co.uk", "org.uk", "ac.uk", "gov.uk", "ltd.uk", "plc.uk", "me.uk",
        "com.au", "net.au", "org.au",
        "co.nz", "co.jp", "co.za", "com.br", "com.mx", "com.cn", "com.sg", "com.hk",
        "co.in", "co.kr", "com.tr"
    );

    private DomainNames() {
    }

    /**
     * Strips scheme, path, port, a leading {@code www.} and a trailing dot, and lower-cases.
     * Returns {@code null} for blank input.
     */
    public static String normalizeHost(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String host = value.trim().toLowerCase(Locale.ROOT);
        int schemeIdx = host.indexOf("://");
        if (schemeIdx >= 0) {
            host = host.substring(schemeIdx + 3);
        }
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        for (char stop : new char[] {'/', '?', '#', ':'}) {
            int idx = host.indexOf(stop);
            if (idx >= 0) {
                host = host.substring(0, idx);
            }
        }
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host.isBlank() ? null : host;
    }

    public static boolean isValidSyntax(String host) {
        return host != null && host.length() <= 253 && DOMAIN_SYNTAX.matcher(host).matches();
    }

    /** The registrable part of a host, e.g. {@code shop.acme.co.uk} gives {@code acme.co.uk}. */
    public static String registrableDomain(String host) {
        String normalized = normalizeHost(host);
        if (normalized == null) {
            return null;
        }
        List<String> labels = List.of(normalized.split("\\."));
        if (labels.size() <= 2) {
            return normalized;
        }
        String lastTwo = labels.get(labels.size() - 2) + "." + labels.get(labels.size() - 1);
        int keep = SECOND_LEVEL_SUFFIXES.contains(lastTwo) ? 3 : 2;
        return String.join(".", labels.subList(labels.size() - keep, labels.size()));
    }

    /** The label directly left of the public suffix ({@code acme} for {@code www.acme.co.uk}). */
    public static String primaryLabel(String host) {
        String registrable = registrableDomain(host);
        if (registrable == null) {
            return null;
        }
        int dot = registrable.indexOf('.');
        return dot < 0 ? registrable : registrable.substring(0, dot);
    }
}

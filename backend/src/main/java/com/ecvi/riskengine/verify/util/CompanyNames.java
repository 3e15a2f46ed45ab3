package com.ecvi.riskengine.verify.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Normalization helpers for legal names: case/whitespace folding, legal-suffix
 * canonicalization and common abbreviation expansion.
 */
public final class CompanyNames {
    private static final Map<String, String> SUFFIX_CANONICAL = Map.ofEntries(
        Map.entry("limited", "ltd"),
        Map.entry("incorporated", "inc"),
        Map.entry("corporation", "corp"),
        Map.entry("company", "co"),
        Map.entry("aktiengesellschaft", "ag"),
        Map.entry("plc", "plc"),
        Map.entry("llc", "llc"),
        Map.entry("llp", "llp"),
        Map.entry("lp", "lp"),
        Map.entry("ltd", "ltd"),
        Map.entry("inc", "inc"),
        Map.entry("corp", "corp"),
        Map.entry("co", "co"),
        Map.entry("gmbh", "gmbh"),
        Map.entry("ag", "ag"),
        Map.entry("sa", "sa"),
        Map.entry("sas", "sas"),
        Map.entry("sarl", "sarl"),
        Map.entry("bv", "bv"),
        Map.entry("nv", "nv"),
        Map.entry("pty", "pty"),
        Map.entry("pte", "pte"),
        Map.entry("spa", "spa"),
        Map.entry("srl", "srl"),
        Map.entry("oy", "oy"),
        Map.entry("ab", "ab"),
        Map.entry("as", "as"),
        Map.entry("kg", "kg")
    );

    private static final Map<String, String> ABBREVIATIONS = Map.ofEntries(
        Map.entry("&", "and"),
        Map.entry("intl", "international"),
        Map.entry("int", "international"),
        Map.entry("natl", "national"),
        Map.entry("mfg", "manufacturing"),
        Map.entry("svcs", "services"),
        Map.entry("svc", "services"),
        Map.entry("tech", "technology"),
        Map.entry("techs", "technologies"),
        Map.entry("grp", "group"),
        Map.entry("hldgs", "holdings"),
        Map.entry("hldg", "holding"),
        Map.entry("assn", "association"),
        Map.entry("assoc", "associates"),
        Map.entry("bros", "brothers"),
        Map.entry("mgmt", "management"),
        Map.entry("dev", "development"),
        Map.entry("sys", "systems"),
        Map.entry("sol", "solutions"),
        Map.entry("ind", "industries"),
        Map.entry("inds", "industries")
    );

    private static final Set<String> STOP_WORDS = Set.of("the", "and", "of", "&");

    private CompanyNames() {
    }

    /** Trim, lower-case and collapse internal whitespace. */
    public static String basicNormalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    /**
     * Lower-cased tokens with dots and apostrophes dropped ({@code L.L.C.} becomes {@code llc})
     * and any other punctuation treated as a separator. {@code &} is kept as its own token.
     */
    public static List<String> tokens(String value) {
        String normalized = basicNormalize(value)
            .replaceAll("[.'’]", "")
            .replace("&", " & ")
            .replaceAll("[^\\p{L}\\p{N}&]+", " ")
            .trim();
        List<String> tokens = new ArrayList<>();
        if (normalized.isEmpty()) {
            return tokens;
        }
        for (String token : normalized.split(" ")) {
            if (!token.isBlank()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /** Name with every legal suffix mapped to its short canonical form. */
    public static String suffixCanonical(String value) {
        List<String> canonical = new ArrayList<>();
        for (String token : tokens(value)) {
            canonical.add(SUFFIX_CANONICAL.getOrDefault(token, token));
        }
        return String.join(" ", canonical);
    }

    /** Tokens with trailing legal suffixes and a leading "the" removed. */
    public static List<String> coreTokens(String value) {
        List<String> tokens = tokens(value);
        while (!tokens.isEmpty() && SUFFIX_CANONICAL.containsKey(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        if (tokens.size() > 1 && tokens.get(0).equals("the")) {
            tokens.remove(0);
        }
        return tokens;
    }

    public static List<String> expandedCoreTokens(String value) {
        List<String> expanded = new ArrayList<>();
        for (String token : coreTokens(value)) {
            expanded.add(ABBREVIATIONS.getOrDefault(token, token));
        }
        return expanded;
    }

    /** Core words useful for matching against a domain label; stop words and one-letter tokens dropped. */
    public static List<String> significantWords(String value) {
        List<String> words = new ArrayList<>();
        for (String token : coreTokens(value)) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                words.add(token);
            }
        }
        return words;
    }

    public static boolean isLegalSuffix(String token) {
        return token != null && SUFFIX_CANONICAL.containsKey(token.toLowerCase(Locale.ROOT));
    }
}

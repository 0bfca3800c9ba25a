package br.fluitax.common.util;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Accent- and case-insensitive normalization of free-text invoice fields
 * (product descriptions, unit labels, company names).
 */
public final class TextNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

    private TextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * "  Café   conilon " -> "CAFE CONILON".
     */
    public static String normalizeText(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Lookup key: normalized text without anything but A-Z and 0-9
     * ("Café Conilon - 60kg" -> "CAFECONILON60KG").
     */
    public static String normalizeKey(String value) {
        return NON_ALPHANUMERIC.matcher(normalizeText(value)).replaceAll("");
    }

    /**
     * Normalized, space-separated tokens.
     */
    public static List<String> tokens(String value) {
        String normalized = normalizeText(value);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }
}

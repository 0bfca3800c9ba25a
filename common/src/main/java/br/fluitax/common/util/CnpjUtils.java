package br.fluitax.common.util;

import java.util.regex.Pattern;

/**
 * Utility class for Brazilian taxpayer identifiers.
 *
 * - CNPJ: 14 digits (companies)
 * - CPF: 11 digits (individuals)
 */
public final class CnpjUtils {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private CnpjUtils() {
        // Utility class - no instantiation
    }

    /**
     * Strip punctuation ("12.345.678/0001-90" -> "12345678000190").
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return NON_DIGITS.matcher(value).replaceAll("");
    }

    /**
     * Check for a 14-digit CNPJ after normalization.
     */
    public static boolean isCnpj(String value) {
        return normalize(value).length() == 14;
    }
}

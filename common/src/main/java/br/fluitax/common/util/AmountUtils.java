package br.fluitax.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Utility class for decimal coercion and the fixed-precision arithmetic used by the Kardex.
 *
 * Quantities and money values cross module boundaries as {@link BigDecimal}; anything
 * else (strings, doubles, Firestore numbers) is coerced here.
 */
public final class AmountUtils {

    /**
     * Fractional digits every ledger value is rounded to before being folded forward.
     */
    public static final int INTERNAL_SCALE = 6;

    /**
     * Scale used for divisions whose result is rounded again by the ledger.
     */
    public static final int WORKING_SCALE = 10;

    private AmountUtils() {
        // Utility class - no instantiation
    }

    /**
     * Coerce an arbitrary value into a decimal.
     *
     * Compatibility shim: historical invoice data contains non-numeric quantities and prices,
     * and reports have always treated them as zero. Malformed input therefore yields
     * {@link BigDecimal#ZERO} instead of an exception.
     *
     * Handles:
     * - BigDecimal and other Number instances
     * - "1234.56", "1234,56" (comma decimal) and "1.234,56" (Brazilian grouping)
     *
     * @param value Value to coerce
     * @return decimal value, or ZERO when null or malformed
     */
    public static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return BigDecimal.ZERO;
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }

        String stringValue = value.toString()
                .replaceAll("[\\s\\u00A0\\u202F\\u2009]+", "")
                .trim();
        if (stringValue.isEmpty()) {
            return BigDecimal.ZERO;
        }

        int lastComma = stringValue.lastIndexOf(',');
        int lastDot = stringValue.lastIndexOf('.');
        if (lastComma >= 0 && lastDot < 0) {
            stringValue = stringValue.replace(",", ".");
        } else if (lastComma > lastDot) {
            // 1.234,56
            stringValue = stringValue.replace(".", "").replace(",", ".");
        } else {
            stringValue = stringValue.replace(",", "");
        }

        try {
            return new BigDecimal(stringValue);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /**
     * Check whether a raw value would be coerced to zero only because it is malformed.
     */
    public static boolean isMalformed(Object value) {
        if (value == null || value instanceof Number) {
            return false;
        }
        String stringValue = value.toString().trim();
        return !stringValue.isEmpty()
                && toDecimal(value).signum() == 0
                && !stringValue.matches("[-+]?[0.,]+");
    }

    /**
     * Round to the internal ledger precision (6 fractional digits, half-up).
     */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(INTERNAL_SCALE);
        }
        return amount.setScale(INTERNAL_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Divide at working precision. A zero divisor yields ZERO.
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (dividend == null || divisor == null || divisor.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, WORKING_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Format with a fixed number of fractional digits ("12.50"). Null formats as empty.
     */
    public static String format(BigDecimal amount, int fractionDigits) {
        if (amount == null) {
            return "";
        }
        return amount.setScale(fractionDigits, RoundingMode.HALF_UP).toPlainString();
    }
}

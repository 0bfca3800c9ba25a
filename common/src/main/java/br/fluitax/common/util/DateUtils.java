package br.fluitax.common.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for date parsing and report period boundaries.
 */
public final class DateUtils {

    private static final DateTimeFormatter ISO_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final Pattern DMY_PATTERN = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");
    private static final Pattern YMD_PATTERN = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    // ISO datetime pattern: YYYY-MM-DDTHH:mm:ss (with optional milliseconds / offset)
    private static final Pattern ISO_DATETIME_PATTERN = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})T.*$");

    private DateUtils() {
        // Utility class - no instantiation
    }

    /**
     * Parse date from the formats accepted by the report endpoints.
     *
     * Supports:
     * - YYYY-MM-DD strings
     * - DD/MM/YYYY strings
     * - ISO datetime strings (time part ignored)
     *
     * @param dateValue Date value in any supported format
     * @return LocalDate or null if parsing fails
     */
    public static LocalDate parseDate(Object dateValue) {
        if (dateValue == null) {
            return null;
        }
        if (dateValue instanceof LocalDate) {
            return (LocalDate) dateValue;
        }
        if (dateValue instanceof LocalDateTime) {
            return ((LocalDateTime) dateValue).toLocalDate();
        }

        String dateStr = dateValue.toString().trim();
        if (dateStr.isEmpty()) {
            return null;
        }

        try {
            Matcher ymdMatcher = YMD_PATTERN.matcher(dateStr);
            if (ymdMatcher.matches()) {
                return LocalDate.of(
                        Integer.parseInt(ymdMatcher.group(1)),
                        Integer.parseInt(ymdMatcher.group(2)),
                        Integer.parseInt(ymdMatcher.group(3)));
            }

            Matcher dmyMatcher = DMY_PATTERN.matcher(dateStr);
            if (dmyMatcher.matches()) {
                return LocalDate.of(
                        Integer.parseInt(dmyMatcher.group(3)),
                        Integer.parseInt(dmyMatcher.group(2)),
                        Integer.parseInt(dmyMatcher.group(1)));
            }

            Matcher isoDatetimeMatcher = ISO_DATETIME_PATTERN.matcher(dateStr);
            if (isoDatetimeMatcher.matches()) {
                return LocalDate.of(
                        Integer.parseInt(isoDatetimeMatcher.group(1)),
                        Integer.parseInt(isoDatetimeMatcher.group(2)),
                        Integer.parseInt(isoDatetimeMatcher.group(3)));
            }
        } catch (java.time.DateTimeException e) {
            // 2025-02-30 and friends
            return null;
        }

        try {
            return LocalDate.parse(dateStr, ISO_FORMAT);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    /**
     * First instant of the day (00:00:00.000).
     */
    public static LocalDateTime startOfDay(LocalDate date) {
        return date == null ? null : date.atStartOfDay();
    }

    /**
     * Last millisecond of the day (23:59:59.999), matching how invoice periods are closed.
     */
    public static LocalDateTime endOfDay(LocalDate date) {
        return date == null ? null : date.atTime(LocalTime.of(23, 59, 59, 999_000_000));
    }

    /**
     * Inclusive range check; null bounds are open.
     */
    public static boolean isWithin(LocalDateTime value, LocalDateTime from, LocalDateTime to) {
        if (value == null) {
            return false;
        }
        if (from != null && value.isBefore(from)) {
            return false;
        }
        return to == null || !value.isAfter(to);
    }
}

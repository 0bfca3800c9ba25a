package br.fluitax.kardex.controller;

import br.fluitax.common.exception.ValidationException;
import br.fluitax.common.util.DateUtils;

import java.time.LocalDate;

/**
 * Query-string date parsing shared by the report controllers.
 */
final class ReportDateParams {

    private ReportDateParams() {
        // Utility class - no instantiation
    }

    /**
     * @return parsed date, or null when the parameter is absent
     * @throws ValidationException when the parameter is present but not a date
     */
    static LocalDate parseOptional(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        LocalDate date = DateUtils.parseDate(value);
        if (date == null) {
            throw new ValidationException(name, "Invalid date '" + value + "'. Use YYYY-MM-DD");
        }
        return date;
    }
}

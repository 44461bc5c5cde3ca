package com.williamcallahan.book_graph.util;

import com.williamcallahan.book_graph.exception.ValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Utility helpers for common null/blank/empty validation checks on mutation input.
 */
public final class ValidationUtils {

    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Trimmed value, or null when the input is null or blank.
     */
    public static String trimToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }

    /**
     * Trimmed value of a required field.
     *
     * @throws ValidationException when the value is null or blank after trimming
     */
    public static String requireText(String value, String field) {
        if (!hasText(value)) {
            throw new ValidationException(field + " is required");
        }
        return value.trim();
    }

    /**
     * Validates an optional calendar date in {@code yyyy-MM-dd} form.
     *
     * @return the trimmed date text, or null when absent
     */
    public static String optionalIsoDate(String value, String field) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            return LocalDate.parse(trimmed).toString();
        } catch (DateTimeParseException ex) {
            throw new ValidationException(field + " must be a yyyy-MM-dd date: '" + value + "'");
        }
    }

    public static int requireRange(Integer value, int min, int max, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        if (value < min || value > max) {
            throw new ValidationException(field + " must be between " + min + " and " + max);
        }
        return value;
    }
}

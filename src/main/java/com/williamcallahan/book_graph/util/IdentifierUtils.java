package com.williamcallahan.book_graph.util;

import com.williamcallahan.book_graph.exception.ValidationException;

/**
 * Converts between the string identifiers surfaced to callers and the integer keys the stores use.
 * Only plain decimal digits are accepted, so every valid id round-trips exactly.
 */
public final class IdentifierUtils {

    private IdentifierUtils() {
    }

    /**
     * Parses a caller-supplied identifier.
     *
     * @param raw   identifier as received; surrounding whitespace is ignored
     * @param field name used in the failure message
     * @return numeric key, {@code >= 0}
     * @throws ValidationException for null, blank, signed, fractional, exponent or overflowing input
     */
    public static long toNumericId(String raw, String field) {
        if (!ValidationUtils.hasText(raw)) {
            throw invalid(raw, field);
        }
        String trimmed = raw.trim();
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c < '0' || c > '9') {
                throw invalid(raw, field);
            }
        }
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException ex) {
            throw invalid(raw, field);
        }
    }

    /**
     * Same as {@link #toNumericId(String, String)} but also rejects zero.
     */
    public static long requirePositiveId(String raw, String field) {
        long id = toNumericId(raw, field);
        if (id <= 0) {
            throw new ValidationException(field + " must be a positive integer: '" + raw + "'");
        }
        return id;
    }

    public static String toExternalId(long id) {
        return Long.toString(id);
    }

    private static ValidationException invalid(String raw, String field) {
        return new ValidationException("Invalid " + field + ": '" + raw + "'");
    }
}

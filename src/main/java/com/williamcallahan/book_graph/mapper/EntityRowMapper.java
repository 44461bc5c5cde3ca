package com.williamcallahan.book_graph.mapper;

import com.williamcallahan.book_graph.model.Author;
import com.williamcallahan.book_graph.model.Book;
import com.williamcallahan.book_graph.model.Review;
import com.williamcallahan.book_graph.repository.AuthorRow;
import com.williamcallahan.book_graph.repository.BookRow;
import com.williamcallahan.book_graph.repository.ReviewRow;
import com.williamcallahan.book_graph.util.IdentifierUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Pure conversions from store rows to the canonical entity shapes.
 *
 * <ul>
 *   <li>ids become decimal strings</li>
 *   <li>calendar dates become 10-character {@code yyyy-MM-dd} text, whatever the driver returned</li>
 *   <li>ratings become a strict {@code int}</li>
 * </ul>
 */
public final class EntityRowMapper {

    static final int DATE_LENGTH = 10;

    private EntityRowMapper() {
    }

    public static Author toAuthor(AuthorRow row) {
        return new Author(
            idOf(row.id()),
            row.firstname(),
            row.lastname(),
            normalizeDate(row.birthdate()),
            normalizeDate(row.deathdate()),
            row.favoritecolor(),
            row.bio(),
            row.nationality(),
            normalizeDate(row.datecreated())
        );
    }

    public static Book toBook(BookRow row) {
        return new Book(
            idOf(row.id()),
            IdentifierUtils.toExternalId(row.authorId()),
            row.title(),
            row.synopsis(),
            row.isbn(),
            normalizeDate(row.publicationdate())
        );
    }

    public static Review toReview(ReviewRow row) {
        return new Review(
            idOf(row.id()),
            IdentifierUtils.toExternalId(row.bookId()),
            row.reviewername(),
            toRating(row.rating()),
            row.comment()
        );
    }

    /**
     * Normalizes a date column to {@code yyyy-MM-dd}.
     * Instants and zoned values are taken in UTC. Text longer than ten characters is truncated,
     * shorter text is returned as is, and null or empty input yields null.
     */
    public static String normalizeDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate localDate) {
            return localDate.toString();
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().toString();
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime.toLocalDate().toString();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate().toString();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.withZoneSameInstant(ZoneOffset.UTC).toLocalDate().toString();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC).toLocalDate().toString();
        }
        if (value instanceof Date date) {
            return date.toInstant().atOffset(ZoneOffset.UTC).toLocalDate().toString();
        }
        String text = value.toString();
        if (text.isEmpty()) {
            return null;
        }
        return text.length() >= DATE_LENGTH ? text.substring(0, DATE_LENGTH) : text;
    }

    /**
     * Narrows a raw rating column to an {@code int}.
     *
     * @throws IllegalArgumentException when the value is null, fractional, out of int range or not numeric
     */
    public static int toRating(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long longValue) {
            return narrow(BigInteger.valueOf(longValue), value);
        }
        if (value instanceof BigInteger bigInteger) {
            return narrow(bigInteger, value);
        }
        if (value instanceof Number || (value instanceof String text && !text.isBlank())) {
            try {
                return fromDecimal(new BigDecimal(value.toString().trim()), value);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Rating is not numeric: '" + value + "'", ex);
            }
        }
        throw new IllegalArgumentException("Rating is not an integer: " + value);
    }

    private static int fromDecimal(BigDecimal decimal, Object original) {
        try {
            return narrow(decimal.toBigIntegerExact(), original);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Rating is not an integer: " + original, ex);
        }
    }

    private static int narrow(BigInteger value, Object original) {
        try {
            return value.intValueExact();
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Rating out of range: " + original, ex);
        }
    }

    private static String idOf(Long id) {
        return id == null ? null : IdentifierUtils.toExternalId(id);
    }
}

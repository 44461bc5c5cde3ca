package com.williamcallahan.book_graph.util;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Shared JDBC helper methods so the store adapters do not repeat the same boilerplate.
 */
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Builds {@code ?, ?, ?} for an {@code IN (...)} clause.
     */
    public static String placeholders(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("placeholder count must be positive: " + count);
        }
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    /**
     * Query for a single object with a RowMapper, returning Optional.
     */
    public static <T> Optional<T> queryForOptionalObject(JdbcTemplate jdbc, String sql, RowMapper<T> rowMapper, Object... params) {
        List<T> results = jdbc.query(sql, rowMapper, params);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Check if a record exists.
     */
    public static boolean exists(JdbcTemplate jdbc, String sql, Object... params) {
        List<Integer> hits = jdbc.query(sql, (rs, rowNum) -> 1, params);
        return !hits.isEmpty();
    }

    /**
     * Long keys as a positional parameter array, in iteration order.
     */
    public static Object[] toParams(Collection<Long> ids) {
        return ids.toArray(new Object[0]);
    }
}

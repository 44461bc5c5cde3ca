package com.williamcallahan.book_graph.repository;

import com.williamcallahan.book_graph.util.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC adapter for the embedded SQLite review store.
 *
 * The backing pool holds exactly one connection; methods additionally synchronize on this
 * instance so an insert and its read-back never interleave with another writer.
 */
@Repository
public class SqliteReviewStore implements ReviewStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteReviewStore.class);

    static final String COLUMNS = "id, book_id, reviewername, rating, comment";

    static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS reviews (
          id INTEGER PRIMARY KEY,
          book_id INTEGER NOT NULL,
          reviewername TEXT NOT NULL,
          rating INTEGER NOT NULL,
          comment TEXT
        )
        """;

    private static final RowMapper<ReviewRow> ROW_MAPPER = SqliteReviewStore::mapRow;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SqliteReviewStore(@Qualifier("reviewsJdbcTemplate") JdbcTemplate jdbcTemplate,
                             @Qualifier("reviewsTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public synchronized List<ReviewRow> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM reviews ORDER BY id", ROW_MAPPER);
    }

    @Override
    public synchronized List<ReviewRow> findByBookIds(Collection<Long> bookIds) {
        if (bookIds == null || bookIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM reviews WHERE book_id IN (" + JdbcUtils.placeholders(bookIds.size()) + ") ORDER BY id",
            ROW_MAPPER,
            JdbcUtils.toParams(bookIds)
        );
    }

    @Override
    public synchronized Optional<ReviewRow> findById(long id) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            "SELECT " + COLUMNS + " FROM reviews WHERE id = ?", ROW_MAPPER, id);
    }

    @Override
    public synchronized ReviewRow insert(ReviewRow row) {
        Long id = transactionTemplate.execute(status -> {
            jdbcTemplate.update("INSERT INTO reviews (book_id, reviewername, rating, comment) VALUES (?, ?, ?, ?)",
                row.bookId(), row.reviewername(), row.rating(), row.comment());
            return jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
        });
        long newId = Objects.requireNonNull(id, "no rowid after insert");
        log.debug("Inserted review {} for book {}", newId, row.bookId());
        return findById(newId).orElseThrow(() -> new IllegalStateException("Review " + newId + " missing after insert"));
    }

    @Override
    public synchronized int deleteByBookIds(Collection<Long> bookIds) {
        if (bookIds == null || bookIds.isEmpty()) {
            return 0;
        }
        Integer deleted = transactionTemplate.execute(status -> jdbcTemplate.update(
            "DELETE FROM reviews WHERE book_id IN (" + JdbcUtils.placeholders(bookIds.size()) + ")",
            JdbcUtils.toParams(bookIds)));
        return deleted == null ? 0 : deleted;
    }

    @Override
    public synchronized int upsertAll(List<ReviewRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        Integer written = transactionTemplate.execute(status -> {
            int total = 0;
            for (ReviewRow row : rows) {
                total += jdbcTemplate.update(
                    "INSERT OR REPLACE INTO reviews (id, book_id, reviewername, rating, comment) VALUES (?, ?, ?, ?, ?)",
                    Objects.requireNonNull(row.id(), "seeded reviews need an id"),
                    row.bookId(), row.reviewername(), row.rating(), row.comment());
            }
            return total;
        });
        return written == null ? 0 : written;
    }

    @Override
    public synchronized long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM reviews", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public synchronized void createSchemaIfMissing() {
        jdbcTemplate.execute(CREATE_TABLE);
    }

    private static ReviewRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewRow(
            rs.getLong("id"),
            rs.getLong("book_id"),
            rs.getString("reviewername"),
            rs.getObject("rating"),
            rs.getString("comment")
        );
    }
}

package com.williamcallahan.book_graph.repository;

import com.williamcallahan.book_graph.util.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * JDBC adapter for the MariaDB/MySQL book store.
 */
@Repository
public class MariaDbBookStore implements BookStore {

    private static final Logger log = LoggerFactory.getLogger(MariaDbBookStore.class);

    static final String COLUMNS = "id, author_id, title, synopsis, isbn, publicationdate";

    static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS books (
          id INT AUTO_INCREMENT PRIMARY KEY,
          author_id INT NOT NULL,
          title VARCHAR(255) NOT NULL,
          synopsis TEXT,
          isbn VARCHAR(32),
          publicationdate DATE
        ) ENGINE=InnoDB
        """;

    static final String UPSERT = """
        INSERT INTO books (id, author_id, title, synopsis, isbn, publicationdate)
        VALUES (?, ?, ?, ?, ?, ?)
        ON DUPLICATE KEY UPDATE
          author_id = VALUES(author_id),
          title = VALUES(title),
          synopsis = VALUES(synopsis),
          isbn = VALUES(isbn),
          publicationdate = VALUES(publicationdate)
        """;

    private static final RowMapper<BookRow> ROW_MAPPER = MariaDbBookStore::mapRow;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public MariaDbBookStore(@Qualifier("booksJdbcTemplate") JdbcTemplate jdbcTemplate,
                            @Qualifier("booksTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public List<BookRow> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM books ORDER BY id", ROW_MAPPER);
    }

    @Override
    public List<BookRow> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM books WHERE id IN (" + JdbcUtils.placeholders(ids.size()) + ")",
            ROW_MAPPER,
            JdbcUtils.toParams(ids)
        );
    }

    @Override
    public List<BookRow> findByAuthorIds(Collection<Long> authorIds) {
        if (authorIds == null || authorIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM books WHERE author_id IN (" + JdbcUtils.placeholders(authorIds.size()) + ") ORDER BY id",
            ROW_MAPPER,
            JdbcUtils.toParams(authorIds)
        );
    }

    @Override
    public Optional<BookRow> findById(long id) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            "SELECT " + COLUMNS + " FROM books WHERE id = ? LIMIT 1", ROW_MAPPER, id);
    }

    @Override
    public boolean existsById(long id) {
        return JdbcUtils.exists(jdbcTemplate, "SELECT 1 FROM books WHERE id = ? LIMIT 1", id);
    }

    @Override
    public List<Long> findIdsByAuthorId(long authorId) {
        return jdbcTemplate.query("SELECT id FROM books WHERE author_id = ? ORDER BY id",
            (rs, rowNum) -> rs.getLong("id"), authorId);
    }

    @Override
    public BookRow insert(BookRow row) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO books (id, author_id, title, synopsis, isbn, publicationdate) VALUES (?, ?, ?, ?, ?, ?)",
                Statement.RETURN_GENERATED_KEYS);
            if (row.id() == null) {
                ps.setNull(1, Types.INTEGER);
            } else {
                ps.setLong(1, row.id());
            }
            ps.setLong(2, row.authorId());
            ps.setString(3, row.title());
            ps.setString(4, row.synopsis());
            ps.setString(5, row.isbn());
            ps.setString(6, row.publicationdate() == null ? null : row.publicationdate().toString());
            return ps;
        }, keyHolder);

        long id = row.id() != null ? row.id() : Objects.requireNonNull(keyHolder.getKey(), "no generated key").longValue();
        log.debug("Inserted book {} for author {}", id, row.authorId());
        return findById(id).orElseThrow(() -> new IllegalStateException("Book " + id + " missing after insert"));
    }

    @Override
    public int deleteByIdsInTransaction(List<Long> bookIds, Consumer<List<Long>> withinTransaction) {
        if (bookIds == null || bookIds.isEmpty()) {
            return 0;
        }
        Integer deleted = transactionTemplate.execute(status -> {
            int count = jdbcTemplate.update(
                "DELETE FROM books WHERE id IN (" + JdbcUtils.placeholders(bookIds.size()) + ")",
                JdbcUtils.toParams(bookIds));
            withinTransaction.accept(List.copyOf(bookIds));
            return count;
        });
        return deleted == null ? 0 : deleted;
    }

    @Override
    public int upsertAll(List<BookRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        Integer written = transactionTemplate.execute(status -> {
            int total = 0;
            for (BookRow row : rows) {
                jdbcTemplate.update(UPSERT,
                    Objects.requireNonNull(row.id(), "seeded books need an id"),
                    row.authorId(),
                    row.title(),
                    row.synopsis(),
                    row.isbn(),
                    row.publicationdate() == null ? null : row.publicationdate().toString());
                total++;
            }
            return total;
        });
        return written == null ? 0 : written;
    }

    @Override
    public void realignIdentity() {
        Long maxId = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(id), 0) FROM books", Long.class);
        long next = (maxId == null ? 0L : maxId) + 1;
        jdbcTemplate.execute("ALTER TABLE books AUTO_INCREMENT = " + next);
        log.info("Realigned books AUTO_INCREMENT to {}", next);
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM books", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public void createSchemaIfMissing() {
        jdbcTemplate.execute(CREATE_TABLE);
    }

    private static BookRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new BookRow(
            rs.getLong("id"),
            rs.getLong("author_id"),
            rs.getString("title"),
            rs.getString("synopsis"),
            rs.getString("isbn"),
            rs.getObject("publicationdate")
        );
    }
}

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
 * JDBC adapter for the Postgres author store.
 */
@Repository
public class PostgresAuthorStore implements AuthorStore {

    private static final Logger log = LoggerFactory.getLogger(PostgresAuthorStore.class);

    static final String COLUMNS =
        "id, firstname, lastname, birthdate, deathdate, favoritecolor, bio, nationality, datecreated";

    static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS authors (
          id SERIAL PRIMARY KEY,
          firstname TEXT NOT NULL,
          lastname TEXT NOT NULL,
          birthdate DATE,
          deathdate DATE,
          favoritecolor TEXT,
          bio TEXT,
          nationality TEXT,
          datecreated DATE
        )
        """;

    /**
     * Moves the id sequence forward past rows written with explicit ids. Never moves it backwards,
     * so ids already handed out to uncommitted inserts are not issued again. Returns no row when
     * the sequence is already ahead.
     */
    static final String ADVANCE_SEQUENCE = """
        SELECT setval(s.seq, s.max_id, true)
        FROM (SELECT pg_get_serial_sequence('authors', 'id')::regclass AS seq,
                     (SELECT MAX(id) FROM authors) AS max_id) s
        WHERE s.max_id IS NOT NULL
          AND s.max_id > COALESCE(pg_sequence_last_value(s.seq), 0)
        """;

    static final String INSERT = """
        INSERT INTO authors (firstname, lastname, birthdate, deathdate, favoritecolor, bio, nationality, datecreated)
        VALUES (?, ?, ?::date, ?::date, ?, ?, ?, ?::date)
        """ + "RETURNING " + COLUMNS;

    static final String UPSERT = """
        INSERT INTO authors (id, firstname, lastname, birthdate, deathdate, favoritecolor, bio, nationality, datecreated)
        VALUES (?, ?, ?, ?::date, ?::date, ?, ?, ?, ?::date)
        ON CONFLICT (id) DO UPDATE SET
          firstname = EXCLUDED.firstname,
          lastname = EXCLUDED.lastname,
          birthdate = EXCLUDED.birthdate,
          deathdate = EXCLUDED.deathdate,
          favoritecolor = EXCLUDED.favoritecolor,
          bio = EXCLUDED.bio,
          nationality = EXCLUDED.nationality,
          datecreated = EXCLUDED.datecreated
        """;

    private static final RowMapper<AuthorRow> ROW_MAPPER = PostgresAuthorStore::mapRow;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public PostgresAuthorStore(@Qualifier("authorsJdbcTemplate") JdbcTemplate jdbcTemplate,
                               @Qualifier("authorsTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public List<AuthorRow> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM authors ORDER BY id", ROW_MAPPER);
    }

    @Override
    public List<AuthorRow> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Long[] idsArray = ids.toArray(new Long[0]);
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM authors WHERE id = ANY(?::BIGINT[])",
            ROW_MAPPER,
            (Object) idsArray
        );
    }

    @Override
    public Optional<AuthorRow> findById(long id) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            "SELECT " + COLUMNS + " FROM authors WHERE id = ?", ROW_MAPPER, id);
    }

    @Override
    public boolean existsById(long id) {
        return JdbcUtils.exists(jdbcTemplate, "SELECT 1 FROM authors WHERE id = ?", id);
    }

    @Override
    public AuthorRow insert(AuthorRow row) {
        AuthorRow stored = transactionTemplate.execute(status -> {
            // Seeding writes explicit ids without touching the sequence.
            jdbcTemplate.queryForList(ADVANCE_SEQUENCE, Long.class);
            return jdbcTemplate.queryForObject(INSERT, ROW_MAPPER,
                row.firstname(),
                row.lastname(),
                textOf(row.birthdate()),
                textOf(row.deathdate()),
                row.favoritecolor(),
                row.bio(),
                row.nationality(),
                textOf(row.datecreated()));
        });
        log.debug("Inserted author {}", stored != null ? stored.id() : null);
        return stored;
    }

    @Override
    public boolean deleteById(long id) {
        return jdbcTemplate.update("DELETE FROM authors WHERE id = ?", id) > 0;
    }

    @Override
    public int upsertAll(List<AuthorRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        Integer written = transactionTemplate.execute(status -> {
            int total = 0;
            for (AuthorRow row : rows) {
                total += jdbcTemplate.update(UPSERT,
                    Objects.requireNonNull(row.id(), "seeded authors need an id"),
                    row.firstname(),
                    row.lastname(),
                    textOf(row.birthdate()),
                    textOf(row.deathdate()),
                    row.favoritecolor(),
                    row.bio(),
                    row.nationality(),
                    textOf(row.datecreated()));
            }
            return total;
        });
        return written == null ? 0 : written;
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM authors", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public void createSchemaIfMissing() {
        jdbcTemplate.execute(CREATE_TABLE);
    }

    private static String textOf(Object value) {
        return value == null ? null : value.toString();
    }

    private static AuthorRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new AuthorRow(
            rs.getLong("id"),
            rs.getString("firstname"),
            rs.getString("lastname"),
            rs.getObject("birthdate"),
            rs.getObject("deathdate"),
            rs.getString("favoritecolor"),
            rs.getString("bio"),
            rs.getString("nationality"),
            rs.getObject("datecreated")
        );
    }
}

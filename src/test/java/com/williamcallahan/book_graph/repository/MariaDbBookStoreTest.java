package com.williamcallahan.book_graph.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MariaDbBookStoreTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private TransactionTemplate transactionTemplate;

    private MariaDbBookStore store;

    @BeforeEach
    void setUp() {
        store = new MariaDbBookStore(jdbcTemplate, transactionTemplate);
    }

    private void runTransactionsInline() {
        when(transactionTemplate.execute(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.doInTransaction(null);
        });
    }

    @Test
    void findByAuthorIds_usesOnePlaceholderPerKey() {
        when(jdbcTemplate.query(startsWith("SELECT"), any(RowMapper.class), eq(1L), eq(2L), eq(3L)))
            .thenReturn(List.of());

        store.findByAuthorIds(List.of(1L, 2L, 3L));

        verify(jdbcTemplate).query(
            eq("SELECT " + MariaDbBookStore.COLUMNS + " FROM books WHERE author_id IN (?, ?, ?) ORDER BY id"),
            any(RowMapper.class), eq(1L), eq(2L), eq(3L));
    }

    @Test
    void emptyKeySets_neverReachTheStore() {
        assertThat(store.findByIds(List.of())).isEmpty();
        assertThat(store.findByAuthorIds(List.of())).isEmpty();
        assertThat(store.deleteByIdsInTransaction(List.of(), ids -> { })).isZero();

        verifyNoInteractions(jdbcTemplate, transactionTemplate);
    }

    @Test
    void deleteByIdsInTransaction_runsCallbackAfterDelete() {
        runTransactionsInline();
        when(jdbcTemplate.update(startsWith("DELETE FROM books"), eq(4L), eq(5L))).thenReturn(2);
        List<List<Long>> seen = new ArrayList<>();

        int deleted = store.deleteByIdsInTransaction(List.of(4L, 5L), seen::add);

        assertThat(deleted).isEqualTo(2);
        assertThat(seen).containsExactly(List.of(4L, 5L));
    }

    @Test
    void deleteByIdsInTransaction_propagatesCallbackFailure() {
        runTransactionsInline();
        when(jdbcTemplate.update(startsWith("DELETE FROM books"), eq(4L))).thenReturn(1);

        assertThatThrownBy(() -> store.deleteByIdsInTransaction(List.of(4L), ids -> {
            throw new DataAccessResourceFailureException("review store locked");
        })).isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void realignIdentity_movesCounterPastMaxId() {
        when(jdbcTemplate.queryForObject("SELECT COALESCE(MAX(id), 0) FROM books", Long.class)).thenReturn(41L);

        store.realignIdentity();

        verify(jdbcTemplate).execute("ALTER TABLE books AUTO_INCREMENT = 42");
    }

    @Test
    void upsertAll_countsEveryRow() {
        runTransactionsInline();

        int written = store.upsertAll(List.of(
            new BookRow(1L, 1L, "Notes", null, null, "1843-09-01"),
            new BookRow(2L, 1L, "Sketch", null, null, null)));

        assertThat(written).isEqualTo(2);
        verify(jdbcTemplate).update(eq(MariaDbBookStore.UPSERT), eq(2L), eq(1L), eq("Sketch"), eq(null), eq(null), eq(null));
    }
}

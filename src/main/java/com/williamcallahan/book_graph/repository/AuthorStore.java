package com.williamcallahan.book_graph.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Store A: the relational store that exclusively owns author records.
 */
public interface AuthorStore {

    List<AuthorRow> findAll();

    /**
     * Bulk fetch. Rows come back in any order; unknown ids are simply absent.
     */
    List<AuthorRow> findByIds(Collection<Long> ids);

    Optional<AuthorRow> findById(long id);

    boolean existsById(long id);

    /**
     * Inserts with a store-generated id, after realigning the id sequence with {@code MAX(id)}.
     *
     * @param row row whose {@code id} is ignored
     * @return the stored row as read back from the store
     */
    AuthorRow insert(AuthorRow row);

    boolean deleteById(long id);

    /**
     * Insert-or-update by caller-supplied id, in one transaction.
     *
     * @return number of rows written
     */
    int upsertAll(List<AuthorRow> rows);

    long count();

    void createSchemaIfMissing();
}

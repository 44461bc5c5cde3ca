package com.williamcallahan.book_graph.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Store C: the embedded single-writer store that exclusively owns reviews. Every call is serialized.
 */
public interface ReviewStore {

    List<ReviewRow> findAll();

    List<ReviewRow> findByBookIds(Collection<Long> bookIds);

    Optional<ReviewRow> findById(long id);

    /**
     * Inserts with a store-generated id and reads the row back.
     */
    ReviewRow insert(ReviewRow row);

    /**
     * Deletes every review of the given books in one store-C transaction.
     *
     * @return number of review rows deleted
     */
    int deleteByBookIds(Collection<Long> bookIds);

    int upsertAll(List<ReviewRow> rows);

    long count();

    void createSchemaIfMissing();
}

package com.williamcallahan.book_graph.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Store B: the relational store that exclusively owns book records.
 */
public interface BookStore {

    List<BookRow> findAll();

    List<BookRow> findByIds(Collection<Long> ids);

    /**
     * Bulk fetch of every book whose {@code author_id} is in {@code authorIds}.
     */
    List<BookRow> findByAuthorIds(Collection<Long> authorIds);

    Optional<BookRow> findById(long id);

    boolean existsById(long id);

    List<Long> findIdsByAuthorId(long authorId);

    /**
     * Inserts one book. A null id lets the store assign one; a non-null id is used as given.
     *
     * @return the stored row as read back from the store
     */
    BookRow insert(BookRow row);

    /**
     * Deletes the given books inside one store-B transaction. {@code withinTransaction} runs after the
     * delete statement and before commit; if it throws, the transaction is rolled back and the
     * exception propagates.
     *
     * @return number of book rows deleted
     */
    int deleteByIdsInTransaction(List<Long> bookIds, Consumer<List<Long>> withinTransaction);

    int upsertAll(List<BookRow> rows);

    /**
     * Moves the identity counter past the highest stored id, after caller-supplied ids were written.
     */
    void realignIdentity();

    long count();

    void createSchemaIfMissing();
}

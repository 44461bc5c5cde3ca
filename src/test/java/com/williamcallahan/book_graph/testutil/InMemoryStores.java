package com.williamcallahan.book_graph.testutil;

import com.williamcallahan.book_graph.repository.AuthorRow;
import com.williamcallahan.book_graph.repository.AuthorStore;
import com.williamcallahan.book_graph.repository.BookRow;
import com.williamcallahan.book_graph.repository.BookStore;
import com.williamcallahan.book_graph.repository.ReviewRow;
import com.williamcallahan.book_graph.repository.ReviewStore;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Map-backed stand-ins for the three stores. Every call is recorded by name so tests can assert
 * how many round trips a resolution took; {@code failOn} makes the named operation throw.
 */
public final class InMemoryStores {

    public final Authors authors = new Authors();
    public final Books books = new Books();
    public final Reviews reviews = new Reviews();

    public final List<String> calls = new CopyOnWriteArrayList<>();
    /** Bulk reads as {@code "operation [keys]"}, in call order. */
    public final List<String> batches = new CopyOnWriteArrayList<>();
    private final List<String> failing = new CopyOnWriteArrayList<>();
    private final List<String> failingOnce = new CopyOnWriteArrayList<>();

    public void failOn(String operation) {
        failing.add(operation);
    }

    public void failNext(String operation) {
        failingOnce.add(operation);
    }

    public long callCount(String operation) {
        return calls.stream().filter(operation::equals).count();
    }

    private void record(String operation) {
        calls.add(operation);
        if (failing.contains(operation) || failingOnce.remove(operation)) {
            throw new DataAccessResourceFailureException("simulated outage in " + operation);
        }
    }

    private void recordBatch(String operation, Collection<Long> keys) {
        batches.add(operation + " " + List.copyOf(keys));
        record(operation);
    }

    public void addAuthor(long id, String firstname, String lastname) {
        authors.rows.put(id, new AuthorRow(id, firstname, lastname, null, null, null, null, null, "2024-01-01"));
    }

    public void addBook(long id, long authorId, String title) {
        books.rows.put(id, new BookRow(id, authorId, title, null, null, null));
    }

    public void addReview(long id, long bookId, String reviewer, int rating) {
        reviews.rows.put(id, new ReviewRow(id, bookId, reviewer, rating, "comment " + id));
    }

    public final class Authors implements AuthorStore {
        final Map<Long, AuthorRow> rows = new TreeMap<>();

        @Override
        public synchronized List<AuthorRow> findAll() {
            record("authors.findAll");
            return new ArrayList<>(rows.values());
        }

        @Override
        public synchronized List<AuthorRow> findByIds(Collection<Long> ids) {
            recordBatch("authors.findByIds", ids);
            return ids.stream().map(rows::get).filter(row -> row != null).toList();
        }

        @Override
        public synchronized Optional<AuthorRow> findById(long id) {
            record("authors.findById");
            return Optional.ofNullable(rows.get(id));
        }

        @Override
        public synchronized boolean existsById(long id) {
            record("authors.existsById");
            return rows.containsKey(id);
        }

        @Override
        public synchronized AuthorRow insert(AuthorRow row) {
            record("authors.insert");
            long id = rows.isEmpty() ? 1 : ((TreeMap<Long, AuthorRow>) rows).lastKey() + 1;
            AuthorRow stored = new AuthorRow(id, row.firstname(), row.lastname(), row.birthdate(), row.deathdate(),
                row.favoritecolor(), row.bio(), row.nationality(), row.datecreated());
            rows.put(id, stored);
            return stored;
        }

        @Override
        public synchronized boolean deleteById(long id) {
            record("authors.deleteById");
            return rows.remove(id) != null;
        }

        @Override
        public synchronized int upsertAll(List<AuthorRow> upserts) {
            record("authors.upsertAll");
            upserts.forEach(row -> rows.put(row.id(), row));
            return upserts.size();
        }

        @Override
        public synchronized long count() {
            return rows.size();
        }

        @Override
        public void createSchemaIfMissing() {
            record("authors.createSchemaIfMissing");
        }
    }

    public final class Books implements BookStore {
        final Map<Long, BookRow> rows = new TreeMap<>();

        @Override
        public synchronized List<BookRow> findAll() {
            record("books.findAll");
            return new ArrayList<>(rows.values());
        }

        @Override
        public synchronized List<BookRow> findByIds(Collection<Long> ids) {
            recordBatch("books.findByIds", ids);
            return ids.stream().map(rows::get).filter(row -> row != null).toList();
        }

        @Override
        public synchronized List<BookRow> findByAuthorIds(Collection<Long> authorIds) {
            recordBatch("books.findByAuthorIds", authorIds);
            return rows.values().stream().filter(row -> authorIds.contains(row.authorId())).toList();
        }

        @Override
        public synchronized Optional<BookRow> findById(long id) {
            record("books.findById");
            return Optional.ofNullable(rows.get(id));
        }

        @Override
        public synchronized boolean existsById(long id) {
            record("books.existsById");
            return rows.containsKey(id);
        }

        @Override
        public synchronized List<Long> findIdsByAuthorId(long authorId) {
            record("books.findIdsByAuthorId");
            return rows.values().stream().filter(row -> row.authorId() == authorId).map(BookRow::id).toList();
        }

        @Override
        public synchronized BookRow insert(BookRow row) {
            record("books.insert");
            long id;
            if (row.id() != null) {
                if (rows.containsKey(row.id())) {
                    throw new DuplicateKeyException("Duplicate entry '" + row.id() + "' for key 'PRIMARY'");
                }
                id = row.id();
            } else {
                id = rows.isEmpty() ? 1 : ((TreeMap<Long, BookRow>) rows).lastKey() + 1;
            }
            BookRow stored = new BookRow(id, row.authorId(), row.title(), row.synopsis(), row.isbn(), row.publicationdate());
            rows.put(id, stored);
            return stored;
        }

        @Override
        public synchronized int deleteByIdsInTransaction(List<Long> bookIds, Consumer<List<Long>> withinTransaction) {
            record("books.deleteByIdsInTransaction");
            Map<Long, BookRow> snapshot = new TreeMap<>(rows);
            int deleted = 0;
            for (Long id : bookIds) {
                if (rows.remove(id) != null) {
                    deleted++;
                }
            }
            try {
                withinTransaction.accept(bookIds);
            } catch (RuntimeException ex) {
                rows.clear();
                rows.putAll(snapshot);
                throw ex;
            }
            return deleted;
        }

        @Override
        public synchronized int upsertAll(List<BookRow> upserts) {
            record("books.upsertAll");
            upserts.forEach(row -> rows.put(row.id(), row));
            return upserts.size();
        }

        @Override
        public void realignIdentity() {
            record("books.realignIdentity");
        }

        @Override
        public synchronized long count() {
            return rows.size();
        }

        @Override
        public void createSchemaIfMissing() {
            record("books.createSchemaIfMissing");
        }
    }

    public final class Reviews implements ReviewStore {
        final Map<Long, ReviewRow> rows = new TreeMap<>();

        @Override
        public synchronized List<ReviewRow> findAll() {
            record("reviews.findAll");
            return new ArrayList<>(rows.values());
        }

        @Override
        public synchronized List<ReviewRow> findByBookIds(Collection<Long> bookIds) {
            recordBatch("reviews.findByBookIds", bookIds);
            return rows.values().stream().filter(row -> bookIds.contains(row.bookId())).toList();
        }

        @Override
        public synchronized Optional<ReviewRow> findById(long id) {
            record("reviews.findById");
            return Optional.ofNullable(rows.get(id));
        }

        @Override
        public synchronized ReviewRow insert(ReviewRow row) {
            record("reviews.insert");
            long id = rows.isEmpty() ? 1 : ((TreeMap<Long, ReviewRow>) rows).lastKey() + 1;
            ReviewRow stored = new ReviewRow(id, row.bookId(), row.reviewername(), row.rating(), row.comment());
            rows.put(id, stored);
            return stored;
        }

        @Override
        public synchronized int deleteByBookIds(Collection<Long> bookIds) {
            record("reviews.deleteByBookIds");
            int before = rows.size();
            rows.values().removeIf(row -> bookIds.contains(row.bookId()));
            return before - rows.size();
        }

        @Override
        public synchronized int upsertAll(List<ReviewRow> upserts) {
            record("reviews.upsertAll");
            upserts.forEach(row -> rows.put(row.id(), row));
            return upserts.size();
        }

        @Override
        public synchronized long count() {
            return rows.size();
        }

        @Override
        public void createSchemaIfMissing() {
            record("reviews.createSchemaIfMissing");
        }
    }
}

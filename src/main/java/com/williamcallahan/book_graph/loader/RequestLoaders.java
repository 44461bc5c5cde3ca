package com.williamcallahan.book_graph.loader;

import com.williamcallahan.book_graph.exception.GraphOperationException;
import com.williamcallahan.book_graph.mapper.EntityRowMapper;
import com.williamcallahan.book_graph.model.Author;
import com.williamcallahan.book_graph.model.Book;
import com.williamcallahan.book_graph.model.Review;
import com.williamcallahan.book_graph.repository.AuthorRow;
import com.williamcallahan.book_graph.repository.BookRow;
import com.williamcallahan.book_graph.repository.ReviewRow;
import com.williamcallahan.book_graph.repository.StoreGateway;
import com.williamcallahan.book_graph.util.AsyncUtils;
import org.dataloader.DataLoader;
import org.dataloader.DataLoaderFactory;
import org.dataloader.DataLoaderOptions;
import org.dataloader.DataLoaderRegistry;
import org.dataloader.MappedBatchLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The four data loader edges of one request, held in a request-owned {@link DataLoaderRegistry}.
 * Keys are numeric store ids.
 *
 * <p>To-one edges resolve a missing row to {@code null}; to-many edges resolve it to an empty list.
 * {@link DataLoader#prime} never replaces an existing entry, so callers that overwrite a cached
 * value clear the key first.</p>
 */
public final class RequestLoaders {

    private static final Logger log = LoggerFactory.getLogger(RequestLoaders.class);

    public static final String AUTHOR_BY_ID = "authorById";
    public static final String BOOKS_BY_AUTHOR_ID = "booksByAuthorId";
    public static final String BOOK_BY_ID = "bookById";
    public static final String REVIEWS_BY_BOOK_ID = "reviewsByBookId";

    private final DataLoaderRegistry registry;
    private final DataLoader<Long, Author> authorById;
    private final DataLoader<Long, List<Book>> booksByAuthorId;
    private final DataLoader<Long, Book> bookById;
    private final DataLoader<Long, List<Review>> reviewsByBookId;

    private RequestLoaders(DataLoader<Long, Author> authorById,
                           DataLoader<Long, List<Book>> booksByAuthorId,
                           DataLoader<Long, Book> bookById,
                           DataLoader<Long, List<Review>> reviewsByBookId) {
        this.authorById = authorById;
        this.booksByAuthorId = booksByAuthorId;
        this.bookById = bookById;
        this.reviewsByBookId = reviewsByBookId;
        this.registry = DataLoaderRegistry.newRegistry()
            .register(AUTHOR_BY_ID, authorById)
            .register(BOOKS_BY_AUTHOR_ID, booksByAuthorId)
            .register(BOOK_BY_ID, bookById)
            .register(REVIEWS_BY_BOOK_ID, reviewsByBookId)
            .build();
    }

    /**
     * Builds a fresh set of loaders bound to one request's scheduler and hooks their dispatch to
     * the scheduler going idle.
     *
     * @param maxBatchSize largest key set per bulk fetch; {@code <= 0} means unlimited
     */
    public static RequestLoaders create(StoreGateway stores,
                                        RequestScheduler scheduler,
                                        int maxBatchSize,
                                        LoaderListener listener) {
        DataLoaderOptions options = DataLoaderOptions.newOptions();
        if (maxBatchSize > 0) {
            options.setMaxBatchSize(maxBatchSize);
        }
        LoaderListener observer = listener == null ? LoaderListener.NO_OP : listener;

        DataLoader<Long, Author> authorById = DataLoaderFactory.newMappedDataLoader(
            edge(AUTHOR_BY_ID,
                keys -> stores.supply("authors.findByIds", () -> stores.authors().findByIds(keys))
                    .thenApply(RequestLoaders::indexAuthors),
                () -> null, scheduler, observer),
            options);

        DataLoader<Long, List<Book>> booksByAuthorId = DataLoaderFactory.newMappedDataLoader(
            edge(BOOKS_BY_AUTHOR_ID,
                keys -> stores.supply("books.findByAuthorIds", () -> stores.books().findByAuthorIds(keys))
                    .thenApply(RequestLoaders::groupBooksByAuthor),
                List::of, scheduler, observer),
            options);

        DataLoader<Long, Book> bookById = DataLoaderFactory.newMappedDataLoader(
            edge(BOOK_BY_ID,
                keys -> stores.supply("books.findByIds", () -> stores.books().findByIds(keys))
                    .thenApply(RequestLoaders::indexBooks),
                () -> null, scheduler, observer),
            options);

        DataLoader<Long, List<Review>> reviewsByBookId = DataLoaderFactory.newMappedDataLoader(
            edge(REVIEWS_BY_BOOK_ID,
                keys -> stores.supply("reviews.findByBookIds", () -> stores.reviews().findByBookIds(keys))
                    .thenApply(RequestLoaders::groupReviewsByBook),
                List::of, scheduler, observer),
            options);

        RequestLoaders loaders = new RequestLoaders(authorById, booksByAuthorId, bookById, reviewsByBookId);
        scheduler.whenIdle(loaders::dispatchPending);
        return loaders;
    }

    /**
     * Wraps a bulk fetch as a mapped batch loader. The fetch's result is handed back on the request
     * scheduler, and keys the store did not return get {@code absent}.
     */
    static <V> MappedBatchLoader<Long, V> edge(String name,
                                              Function<List<Long>, CompletableFuture<Map<Long, V>>> fetch,
                                              Supplier<V> absent,
                                              Executor scheduler,
                                              LoaderListener listener) {
        return keys -> {
            List<Long> ids = List.copyOf(keys);
            listener.onBatch(name, ids.size());
            log.debug("Loader {} fetching {} keys", name, ids.size());

            CompletableFuture<Map<Long, V>> result = new CompletableFuture<>();
            AsyncUtils.attempt(() -> fetch.apply(ids))
                .whenComplete((values, error) -> scheduler.execute(() -> {
                    if (error != null) {
                        Throwable cause = GraphOperationException.unwrap(error);
                        listener.onBatchFailure(name, ids.size(), cause);
                        log.warn("Loader {} batch of {} keys failed: {}", name, ids.size(), cause.getMessage());
                        result.completeExceptionally(cause);
                        return;
                    }
                    result.complete(withAbsentKeys(ids, values, absent));
                }));
            return result;
        };
    }

    private static <V> Map<Long, V> withAbsentKeys(List<Long> ids, Map<Long, V> found, Supplier<V> absent) {
        Map<Long, V> complete = new HashMap<>();
        if (found != null) {
            complete.putAll(found);
        }
        V fallback = absent.get();
        if (fallback != null) {
            for (Long id : ids) {
                complete.putIfAbsent(id, fallback);
            }
        }
        return complete;
    }

    /**
     * Sends every queued key to its store. No-op when nothing is queued.
     */
    public void dispatchPending() {
        if (registry.dispatchDepth() > 0) {
            registry.dispatchAll();
        }
    }

    static Map<Long, Author> indexAuthors(List<AuthorRow> rows) {
        Map<Long, Author> byId = new LinkedHashMap<>();
        for (AuthorRow row : rows) {
            byId.put(row.id(), EntityRowMapper.toAuthor(row));
        }
        return byId;
    }

    static Map<Long, Book> indexBooks(List<BookRow> rows) {
        Map<Long, Book> byId = new LinkedHashMap<>();
        for (BookRow row : rows) {
            byId.put(row.id(), EntityRowMapper.toBook(row));
        }
        return byId;
    }

    static Map<Long, List<Book>> groupBooksByAuthor(List<BookRow> rows) {
        Map<Long, List<Book>> grouped = new LinkedHashMap<>();
        for (BookRow row : rows) {
            grouped.computeIfAbsent(row.authorId(), key -> new ArrayList<>()).add(EntityRowMapper.toBook(row));
        }
        grouped.replaceAll((key, books) -> List.copyOf(books));
        return grouped;
    }

    static Map<Long, List<Review>> groupReviewsByBook(List<ReviewRow> rows) {
        Map<Long, List<Review>> grouped = new LinkedHashMap<>();
        for (ReviewRow row : rows) {
            grouped.computeIfAbsent(row.bookId(), key -> new ArrayList<>()).add(EntityRowMapper.toReview(row));
        }
        grouped.replaceAll((key, reviews) -> List.copyOf(reviews));
        return grouped;
    }

    public DataLoader<Long, Author> authorById() {
        return authorById;
    }

    public DataLoader<Long, List<Book>> booksByAuthorId() {
        return booksByAuthorId;
    }

    public DataLoader<Long, Book> bookById() {
        return bookById;
    }

    public DataLoader<Long, List<Review>> reviewsByBookId() {
        return reviewsByBookId;
    }
}

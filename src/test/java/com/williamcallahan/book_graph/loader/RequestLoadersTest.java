package com.williamcallahan.book_graph.loader;

import com.williamcallahan.book_graph.exception.StoreAccessException;
import com.williamcallahan.book_graph.model.Author;
import com.williamcallahan.book_graph.model.Book;
import com.williamcallahan.book_graph.model.Review;
import com.williamcallahan.book_graph.monitoring.MetricsService;
import com.williamcallahan.book_graph.repository.StoreGateway;
import com.williamcallahan.book_graph.testutil.InMemoryStores;
import com.williamcallahan.book_graph.testutil.TestContexts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestLoadersTest {

    private InMemoryStores stores;
    private StoreGateway gateway;
    private RequestScheduler scheduler;
    private RequestLoaders loaders;

    @BeforeEach
    void setUp() {
        stores = new InMemoryStores();
        MetricsService metrics = TestContexts.metrics();
        gateway = TestContexts.gateway(stores, metrics);
        scheduler = new RequestScheduler(TestContexts.DIRECT, "test");
        loaders = RequestLoaders.create(gateway, scheduler, 0, LoaderListener.NO_OP);

        stores.addAuthor(1, "Ada", "Lovelace");
        stores.addAuthor(2, "Grace", "Hopper");
        stores.addBook(1, 1, "Notes");
        stores.addBook(2, 1, "Sketch");
        stores.addBook(3, 2, "Compilers");
        stores.addReview(1, 1, "Bob", 5);
        stores.addReview(2, 1, "Eve", 4);
    }

    @Test
    @DisplayName("loads issued before the request goes idle share one bulk fetch")
    void loadsInOneTick_areBatched() {
        List<CompletableFuture<Book>> futures = new ArrayList<>();

        scheduler.execute(() -> {
            futures.add(loaders.bookById().load(3L));
            futures.add(loaders.bookById().load(1L));
            futures.add(loaders.bookById().load(2L));
        });

        assertThat(stores.batches).containsExactly("books.findByIds [3, 1, 2]");
        assertThat(futures).extracting(future -> future.join().title())
            .containsExactly("Compilers", "Notes", "Sketch");
    }

    @Test
    @DisplayName("loadMany keeps input order and duplicates while fetching each key once")
    void loadMany_preservesOrderAndDuplicates() {
        AtomicReference<CompletableFuture<List<Book>>> result = new AtomicReference<>();

        scheduler.execute(() -> result.set(loaders.bookById().loadMany(List.of(2L, 404L, 2L, 1L))));

        assertThat(stores.batches).containsExactly("books.findByIds [2, 404, 1]");
        assertThat(result.get().join()).extracting(book -> book == null ? null : book.title())
            .containsExactly("Sketch", null, "Sketch", "Notes");
    }

    @Test
    void everyEdge_fetchesOncePerWindow() {
        scheduler.execute(() -> {
            loaders.authorById().load(1L);
            loaders.authorById().load(2L);
            loaders.booksByAuthorId().load(1L);
            loaders.booksByAuthorId().load(2L);
            loaders.reviewsByBookId().load(1L);
            loaders.reviewsByBookId().load(3L);
        });

        assertThat(stores.batches).containsExactlyInAnyOrder(
            "authors.findByIds [1, 2]",
            "books.findByAuthorIds [1, 2]",
            "reviews.findByBookIds [1, 3]");
    }

    @Test
    @DisplayName("cached and primed keys never reach the store again")
    void cachedKeys_skipStore() {
        scheduler.execute(() -> loaders.authorById().load(1L));
        loaders.authorById().prime(7L, new Author("7", "Primed", "Author", null, null, null, null, null, null));

        AtomicReference<CompletableFuture<List<Author>>> second = new AtomicReference<>();
        scheduler.execute(() -> second.set(loaders.authorById().loadMany(List.of(1L, 7L))));

        assertThat(stores.batches).containsExactly("authors.findByIds [1]");
        assertThat(second.get().join()).extracting(Author::firstname).containsExactly("Ada", "Primed");
    }

    @Test
    @DisplayName("continuations that load again are coalesced into the next window")
    void continuations_formNextWindow() {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());

        scheduler.execute(() -> {
            for (long bookId : List.of(1L, 3L)) {
                loaders.bookById().load(bookId).thenAccept(book -> loaders.authorById()
                    .load(Long.parseLong(book.authorId()))
                    .thenAccept(author -> seen.add(book.title() + " by " + author.lastname())));
            }
        });

        assertThat(stores.batches).containsExactly("books.findByIds [1, 3]", "authors.findByIds [1, 2]");
        assertThat(seen).containsExactlyInAnyOrder("Notes by Lovelace", "Compilers by Hopper");
    }

    @Test
    @DisplayName("clearing a key that is still queued keeps every waiting caller")
    void clearWhileQueued_completesEveryCaller() {
        List<CompletableFuture<Book>> futures = new ArrayList<>();

        scheduler.execute(() -> {
            futures.add(loaders.bookById().load(1L));
            loaders.bookById().clear(1L);
            futures.add(loaders.bookById().load(1L));
        });

        assertThat(stores.batches).containsExactly("books.findByIds [1]");
        assertThat(futures).allSatisfy(future -> assertThat(future).isDone());
        assertThat(futures).extracting(future -> future.join().title()).containsExactly("Notes", "Notes");
    }

    @Test
    @DisplayName("a failed batch fails every key and evicts them for a later retry")
    void failedBatch_failsAllKeysAndEvicts() {
        stores.failNext("authors.findByIds");
        List<CompletableFuture<Author>> first = new ArrayList<>();

        scheduler.execute(() -> {
            first.add(loaders.authorById().load(1L));
            first.add(loaders.authorById().load(2L));
        });

        assertThat(first).allSatisfy(future -> assertThatThrownBy(future::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(StoreAccessException.class));

        AtomicReference<CompletableFuture<Author>> retry = new AtomicReference<>();
        scheduler.execute(() -> retry.set(loaders.authorById().load(1L)));

        assertThat(retry.get().join().lastname()).isEqualTo("Lovelace");
        assertThat(stores.batches).containsExactly("authors.findByIds [1, 2]", "authors.findByIds [1]");
    }

    @Test
    @DisplayName("to-many edges resolve missing keys to an empty list, to-one edges to null")
    void absentKeys_resolveToEdgeDefault() {
        AtomicReference<CompletableFuture<List<List<Review>>>> reviews = new AtomicReference<>();
        AtomicReference<CompletableFuture<Author>> author = new AtomicReference<>();

        scheduler.execute(() -> {
            reviews.set(loaders.reviewsByBookId().loadMany(List.of(1L, 2L)));
            author.set(loaders.authorById().load(99L));
        });

        assertThat(reviews.get().join().get(0)).extracting(Review::reviewerName).containsExactly("Bob", "Eve");
        assertThat(reviews.get().join().get(1)).isEmpty();
        assertThat(author.get().join()).isNull();
    }

    @Test
    @DisplayName("clear then prime replaces a cached value")
    void clearThenPrime_replacesCachedValue() {
        scheduler.execute(() -> loaders.authorById().load(1L));
        loaders.authorById().clear(1L).prime(1L, (Author) null);

        AtomicReference<CompletableFuture<Author>> again = new AtomicReference<>();
        scheduler.execute(() -> again.set(loaders.authorById().load(1L)));

        assertThat(again.get().join()).isNull();
        assertThat(stores.batches).containsExactly("authors.findByIds [1]");
    }

    @Test
    @DisplayName("maxBatchSize splits a large window into several bulk fetches")
    void maxBatchSize_splitsWindow() {
        RequestScheduler bounded = new RequestScheduler(TestContexts.DIRECT, "bounded");
        RequestLoaders small = RequestLoaders.create(gateway, bounded, 2, LoaderListener.NO_OP);
        AtomicReference<CompletableFuture<List<Book>>> result = new AtomicReference<>();

        bounded.execute(() -> result.set(small.bookById().loadMany(List.of(1L, 2L, 3L, 4L, 5L))));

        assertThat(stores.batches).containsExactly(
            "books.findByIds [1, 2]", "books.findByIds [3, 4]", "books.findByIds [5]");
        assertThat(result.get().join()).hasSize(5);
    }

    @Test
    void listener_seesDistinctKeyCounts() {
        List<String> events = new ArrayList<>();
        LoaderListener listener = new LoaderListener() {
            @Override
            public void onBatch(String loaderName, int keyCount) {
                events.add(loaderName + ":" + keyCount);
            }
        };
        RequestScheduler observed = new RequestScheduler(TestContexts.DIRECT, "observed");
        RequestLoaders watched = RequestLoaders.create(gateway, observed, 0, listener);

        observed.execute(() -> watched.bookById().loadMany(List.of(1L, 2L, 2L)));

        assertThat(events).containsExactly(RequestLoaders.BOOK_BY_ID + ":2");
    }

    @Test
    void booksByAuthor_keepsRowOrderPerAuthor() {
        AtomicReference<CompletableFuture<List<Book>>> books = new AtomicReference<>();

        scheduler.execute(() -> books.set(loaders.booksByAuthorId().load(1L)));

        assertThat(books.get().join()).extracting(Book::title).containsExactly("Notes", "Sketch");
        assertThat(stores.batches).containsExactly("books.findByAuthorIds [1]");
    }
}

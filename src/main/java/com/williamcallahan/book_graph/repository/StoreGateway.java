package com.williamcallahan.book_graph.repository;

import com.williamcallahan.book_graph.exception.GraphOperationException;
import com.williamcallahan.book_graph.exception.StoreAccessException;
import com.williamcallahan.book_graph.monitoring.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Process-wide handle to the three stores. Every store call is issued through {@link #supply},
 * which runs it on the shared store executor so the calling request is never blocked on I/O.
 */
@Component
public class StoreGateway {

    private static final Logger log = LoggerFactory.getLogger(StoreGateway.class);

    private final AuthorStore authors;
    private final BookStore books;
    private final ReviewStore reviews;
    private final Executor storeExecutor;
    private final MetricsService metricsService;

    public StoreGateway(AuthorStore authors,
                        BookStore books,
                        ReviewStore reviews,
                        @Qualifier("storeExecutor") Executor storeExecutor,
                        MetricsService metricsService) {
        this.authors = authors;
        this.books = books;
        this.reviews = reviews;
        this.storeExecutor = storeExecutor;
        this.metricsService = metricsService;
    }

    /**
     * Runs one store call asynchronously. Failures are wrapped in {@link StoreAccessException}
     * naming {@code operation}; exceptions the aggregation layer already typed pass through.
     */
    public <T> CompletableFuture<T> supply(String operation, Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return metricsService.recordStoreCall(operation, call);
            } catch (GraphOperationException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                metricsService.incrementStoreError();
                log.error("Store call {} failed: {}", operation, ex.getMessage(), ex);
                throw new StoreAccessException(operation, ex);
            }
        }, storeExecutor);
    }

    public AuthorStore authors() {
        return authors;
    }

    public BookStore books() {
        return books;
    }

    public ReviewStore reviews() {
        return reviews;
    }
}

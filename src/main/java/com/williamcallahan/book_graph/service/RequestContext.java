package com.williamcallahan.book_graph.service;

import com.williamcallahan.book_graph.exception.GraphOperationException;
import com.williamcallahan.book_graph.loader.RequestLoaders;
import com.williamcallahan.book_graph.loader.RequestScheduler;
import com.williamcallahan.book_graph.repository.StoreGateway;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Everything one request needs while its fields resolve: its own scheduler, its own loaders,
 * and the process-wide store handle. Built by {@link RequestContextFactory}, owned by exactly one
 * request and dropped when the request completes.
 */
public final class RequestContext {

    private final String requestId;
    private final RequestScheduler scheduler;
    private final RequestLoaders loaders;
    private final StoreGateway stores;

    public RequestContext(String requestId, RequestScheduler scheduler, RequestLoaders loaders, StoreGateway stores) {
        this.requestId = requestId;
        this.scheduler = scheduler;
        this.loaders = loaders;
        this.stores = stores;
    }

    /**
     * Starts {@code work} as a task on this request's scheduler. The returned future fails with the
     * unwrapped cause when {@code work} throws or its future fails.
     */
    public <T> CompletableFuture<T> run(Supplier<CompletableFuture<T>> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        scheduler.execute(() -> {
            CompletableFuture<T> inner;
            try {
                inner = work.get();
            } catch (RuntimeException ex) {
                result.completeExceptionally(ex);
                return;
            }
            inner.whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(GraphOperationException.unwrap(error));
                } else {
                    result.complete(value);
                }
            });
        });
        return result;
    }

    /**
     * One store call: runs on the store executor, completes back on this request's scheduler.
     */
    public <T> CompletableFuture<T> supplyFromStore(String operation, Supplier<T> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        stores.supply(operation, call).whenComplete((value, error) -> scheduler.execute(() -> {
            if (error != null) {
                result.completeExceptionally(GraphOperationException.unwrap(error));
            } else {
                result.complete(value);
            }
        }));
        return result;
    }

    public String getRequestId() {
        return requestId;
    }

    public RequestLoaders loaders() {
        return loaders;
    }

    public StoreGateway stores() {
        return stores;
    }
}

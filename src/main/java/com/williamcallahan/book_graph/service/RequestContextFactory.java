package com.williamcallahan.book_graph.service;

import com.williamcallahan.book_graph.config.AppConfigurationProperties;
import com.williamcallahan.book_graph.loader.LoaderListener;
import com.williamcallahan.book_graph.loader.RequestLoaders;
import com.williamcallahan.book_graph.loader.RequestScheduler;
import com.williamcallahan.book_graph.repository.StoreGateway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds a fresh {@link RequestContext} per incoming request. Nothing in a context is reused
 * by another request.
 */
@Component
public class RequestContextFactory {

    private final StoreGateway stores;
    private final Executor resolverExecutor;
    private final LoaderListener loaderListener;
    private final int maxBatchSize;
    private final AtomicLong sequence = new AtomicLong();

    public RequestContextFactory(StoreGateway stores,
                                 @Qualifier("resolverExecutor") Executor resolverExecutor,
                                 LoaderListener loaderListener,
                                 AppConfigurationProperties properties) {
        this.stores = stores;
        this.resolverExecutor = resolverExecutor;
        this.loaderListener = loaderListener;
        this.maxBatchSize = properties.getLoader().getMaxBatchSize();
    }

    public RequestContext open() {
        String requestId = "req-" + sequence.incrementAndGet();
        RequestScheduler scheduler = new RequestScheduler(resolverExecutor, requestId);
        RequestLoaders loaders = RequestLoaders.create(stores, scheduler, maxBatchSize, loaderListener);
        return new RequestContext(requestId, scheduler, loaders, stores);
    }
}

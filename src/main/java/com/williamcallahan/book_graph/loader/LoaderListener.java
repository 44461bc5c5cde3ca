package com.williamcallahan.book_graph.loader;

/**
 * Observes batch execution, e.g. for metrics.
 */
public interface LoaderListener {

    LoaderListener NO_OP = new LoaderListener() {
    };

    default void onBatch(String loaderName, int keyCount) {
    }

    default void onBatchFailure(String loaderName, int keyCount, Throwable error) {
    }
}

package com.williamcallahan.book_graph.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base type for every failure surfaced by the aggregation layer.
 */
public abstract class GraphOperationException extends RuntimeException {

    private final FailureKind kind;

    protected GraphOperationException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GraphOperationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * Strips {@link CompletionException} / {@link ExecutionException} wrappers added by future composition.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

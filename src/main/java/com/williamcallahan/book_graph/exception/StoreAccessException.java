package com.williamcallahan.book_graph.exception;

/**
 * Wraps a store fault with the name of the operation that issued it. The original
 * exception is kept as the cause, unmodified.
 */
public class StoreAccessException extends GraphOperationException {

    private final String operation;

    public StoreAccessException(String operation, Throwable cause) {
        super(FailureKind.STORE, operation + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}

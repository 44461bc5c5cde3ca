package com.williamcallahan.book_graph.exception;

public class ConflictException extends GraphOperationException {

    public ConflictException(String message) {
        super(FailureKind.CONFLICT, message);
    }
}

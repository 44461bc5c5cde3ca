package com.williamcallahan.book_graph.exception;

public class ValidationException extends GraphOperationException {

    public ValidationException(String message) {
        super(FailureKind.VALIDATION, message);
    }
}

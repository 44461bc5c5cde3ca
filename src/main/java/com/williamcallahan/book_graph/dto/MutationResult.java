package com.williamcallahan.book_graph.dto;

import com.williamcallahan.book_graph.exception.FailureKind;
import com.williamcallahan.book_graph.exception.GraphOperationException;

import java.util.concurrent.CompletableFuture;

/**
 * Outcome of a mutation as seen by the caller: either a value or a typed failure.
 * Anything that is not a {@link GraphOperationException} is reported as a {@link FailureKind#STORE} failure
 * with a generic message.
 */
public record MutationResult<T>(T value, FailureKind failure, String message) {

    public static <T> MutationResult<T> success(T value) {
        return new MutationResult<>(value, null, null);
    }

    public static <T> MutationResult<T> failure(FailureKind kind, String message) {
        return new MutationResult<>(null, kind, message);
    }

    public static <T> MutationResult<T> fromError(Throwable error) {
        Throwable cause = GraphOperationException.unwrap(error);
        if (cause instanceof GraphOperationException typed) {
            return failure(typed.getKind(), typed.getMessage());
        }
        return failure(FailureKind.STORE, "Unexpected store failure");
    }

    /**
     * Folds a pending mutation into a result that always completes normally.
     */
    public static <T> CompletableFuture<MutationResult<T>> from(CompletableFuture<T> pending) {
        return pending.handle((value, error) -> error == null ? success(value) : fromError(error));
    }

    public boolean isSuccess() {
        return failure == null;
    }
}

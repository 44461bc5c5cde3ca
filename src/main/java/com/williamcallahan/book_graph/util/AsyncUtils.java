/**
 * Utility class for common CompletableFuture composition patterns
 *
 * @author William Callahan
 */

package com.williamcallahan.book_graph.util;

import com.williamcallahan.book_graph.exception.GraphOperationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

public final class AsyncUtils {

    private AsyncUtils() {
    }

    /**
     * Waits for every future and returns their values in input order. Fails if any input fails.
     */
    public static <T> CompletableFuture<List<T>> sequence(List<CompletableFuture<T>> futures) {
        if (futures.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                List<T> values = new ArrayList<>(futures.size());
                for (CompletableFuture<T> future : futures) {
                    values.add(future.join());
                }
                return values;
            });
    }

    /**
     * Recovers a failed field into {@code fallback}, recording the failure under {@code field}.
     * Used so one failing relationship does not take its siblings down.
     */
    public static <T> CompletableFuture<T> recoverField(CompletableFuture<T> future,
                                                        String field,
                                                        Map<String, String> errors,
                                                        Supplier<T> fallback) {
        return future.handle((value, error) -> {
            if (error == null) {
                return value;
            }
            Throwable cause = GraphOperationException.unwrap(error);
            errors.put(field, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
            return fallback.get();
        });
    }

    /**
     * Runs {@code action} and returns its value as a completed future, or a failed future when it throws.
     * Lets validation that throws synchronously surface through the same future as store failures.
     */
    public static <T> CompletableFuture<T> attempt(Supplier<CompletableFuture<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }
}

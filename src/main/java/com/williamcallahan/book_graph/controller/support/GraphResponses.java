package com.williamcallahan.book_graph.controller.support;

import com.williamcallahan.book_graph.dto.MutationResult;
import com.williamcallahan.book_graph.exception.FailureKind;
import com.williamcallahan.book_graph.exception.GraphOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Bridges a request's resolution future to a {@code Mono<ResponseEntity>}.
 */
public final class GraphResponses {

    private static final Logger log = LoggerFactory.getLogger(GraphResponses.class);

    private GraphResponses() {
    }

    public static <T> Mono<ResponseEntity<?>> respond(CompletableFuture<T> pending, HttpStatus status, String description) {
        return Mono.fromFuture(pending)
            .<ResponseEntity<?>>map(body -> ResponseEntity.status(status).body(body))
            .onErrorResume(ex -> {
                logFailure(ex, description);
                return Mono.just(ErrorResponseUtils.toResponse(ex));
            });
    }

    public static <T> Mono<ResponseEntity<?>> ok(CompletableFuture<T> pending, String description) {
        return respond(pending, HttpStatus.OK, description);
    }

    /**
     * Mutation responses: the pending write is folded into a {@link MutationResult} first, so every
     * failure reaches the caller as a typed kind.
     */
    public static <T> Mono<ResponseEntity<?>> mutation(CompletableFuture<T> pending, HttpStatus status, String description) {
        CompletableFuture<T> logged = pending.whenComplete((value, error) -> {
            if (error != null) {
                logFailure(error, description);
            }
        });
        return Mono.fromFuture(MutationResult.from(logged))
            .<ResponseEntity<?>>map(result -> result.isSuccess()
                ? ResponseEntity.status(status).body(result.value())
                : ErrorResponseUtils.toResponse(result));
    }

    private static void logFailure(Throwable error, String description) {
        Throwable cause = GraphOperationException.unwrap(error);
        if (cause instanceof GraphOperationException typed && typed.getKind() != FailureKind.STORE
                && typed.getKind() != FailureKind.INCONSISTENT) {
            log.debug("{}: {}", description, typed.getMessage());
            return;
        }
        log.error("{}: {}", description, cause.getMessage(), cause);
    }
}

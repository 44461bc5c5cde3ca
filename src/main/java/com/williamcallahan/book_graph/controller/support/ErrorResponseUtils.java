package com.williamcallahan.book_graph.controller.support;

import com.williamcallahan.book_graph.dto.MutationResult;
import com.williamcallahan.book_graph.exception.FailureKind;
import com.williamcallahan.book_graph.exception.GraphOperationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String error) {
        return errorBody(error, null);
    }

    public static Map<String, String> errorBody(String error, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null && !message.isBlank()) {
            body.put("message", message);
        }
        return body;
    }

    public static HttpStatus statusFor(FailureKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INCONSISTENT -> HttpStatus.INTERNAL_SERVER_ERROR;
            case STORE -> HttpStatus.BAD_GATEWAY;
        };
    }

    /**
     * Error response for a failed resolution: typed failures keep their kind, anything else is a 500.
     */
    public static ResponseEntity<Map<String, String>> toResponse(Throwable error) {
        Throwable cause = GraphOperationException.unwrap(error);
        if (cause instanceof GraphOperationException typed) {
            return ResponseEntity.status(statusFor(typed.getKind()))
                .body(errorBody(typed.getKind().name().toLowerCase(Locale.ROOT), typed.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorBody("internal", "Unexpected error"));
    }

    public static ResponseEntity<Map<String, String>> toResponse(MutationResult<?> failed) {
        return ResponseEntity.status(statusFor(failed.failure()))
            .body(errorBody(failed.failure().name().toLowerCase(Locale.ROOT), failed.message()));
    }
}

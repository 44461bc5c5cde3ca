package com.williamcallahan.book_graph.exception;

/**
 * Failure categories a caller can act on. Each maps to one HTTP status at the controller edge.
 */
public enum FailureKind {
    /** Malformed identifier, missing field, out-of-range value. Nothing was written. */
    VALIDATION,
    /** A referenced author or book does not exist. */
    NOT_FOUND,
    /** An explicitly supplied identifier is already taken. */
    CONFLICT,
    /** Store B committed but the store A step failed; stores diverge until reconciled. */
    INCONSISTENT,
    /** A store call failed or timed out. */
    STORE
}

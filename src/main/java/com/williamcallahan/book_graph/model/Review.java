package com.williamcallahan.book_graph.model;

/**
 * Canonical review shape. Owned by the embedded SQLite store.
 */
public record Review(
    String id,
    String bookId,
    String reviewerName,
    int rating,
    String comment
) {
}

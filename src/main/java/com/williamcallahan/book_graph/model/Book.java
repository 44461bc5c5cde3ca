package com.williamcallahan.book_graph.model;

/**
 * Canonical book shape. Owned by the MariaDB store; {@code authorId} points into the
 * Postgres author store and is only checked by the application.
 */
public record Book(
    String id,
    String authorId,
    String title,
    String synopsis,
    String isbn,
    String publicationDate
) {
}

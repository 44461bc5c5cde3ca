package com.williamcallahan.book_graph.repository;

/**
 * One row of the SQLite {@code reviews} table ({@code id, book_id, reviewername, rating, comment}).
 * SQLite is loosely typed, so {@code rating} is kept as the raw column value.
 *
 * @param id null when the store should generate it
 */
public record ReviewRow(
    Long id,
    long bookId,
    String reviewername,
    Object rating,
    String comment
) {
}

package com.williamcallahan.book_graph.repository;

/**
 * One row of the MariaDB {@code books} table ({@code id, author_id, title, synopsis, isbn, publicationdate}).
 *
 * @param id null when the store should generate it
 */
public record BookRow(
    Long id,
    long authorId,
    String title,
    String synopsis,
    String isbn,
    Object publicationdate
) {
}

package com.williamcallahan.book_graph.dto;

/**
 * Create-book payload.
 *
 * @param id     optional explicit identifier; must not already exist
 * @param authorId required, must reference an existing author
 */
public record BookInput(
    String id,
    String authorId,
    String title,
    String synopsis,
    String isbn,
    String publicationDate
) {
}

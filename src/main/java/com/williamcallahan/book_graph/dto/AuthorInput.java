package com.williamcallahan.book_graph.dto;

/**
 * Create-author payload. Dates are {@code yyyy-MM-dd}; {@code dateCreated} defaults to today.
 */
public record AuthorInput(
    String firstname,
    String lastname,
    String birthdate,
    String deathdate,
    String favoriteColor,
    String bio,
    String nationality,
    String dateCreated
) {
}

package com.williamcallahan.book_graph.model;

/**
 * Canonical author shape as surfaced to callers. Owned by the Postgres store.
 *
 * @param id          decimal string of the store-native integer id
 * @param firstname   required
 * @param lastname    required
 * @param birthdate   {@code yyyy-MM-dd} or null
 * @param deathdate   {@code yyyy-MM-dd} or null
 * @param favoriteColor free text, optional
 * @param bio         free text, optional
 * @param nationality free text, optional
 * @param dateCreated {@code yyyy-MM-dd}; defaults to the creation day
 */
public record Author(
    String id,
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

package com.williamcallahan.book_graph.seed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Shapes of the seed files. Keys follow the files as shipped ({@code favoritecolor}, {@code authorId}, ...).
 */
final class SeedRecords {

    private SeedRecords() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedAuthor(
        @JsonProperty("id") Long id,
        @JsonProperty("firstname") String firstname,
        @JsonProperty("lastname") String lastname,
        @JsonProperty("birthdate") String birthdate,
        @JsonProperty("deathdate") String deathdate,
        @JsonProperty("favoritecolor") String favoritecolor,
        @JsonProperty("bio") String bio,
        @JsonProperty("nationality") String nationality,
        @JsonProperty("datecreated") String datecreated
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedBook(
        @JsonProperty("id") Long id,
        @JsonProperty("authorId") Long authorId,
        @JsonProperty("title") String title,
        @JsonProperty("synopsis") String synopsis,
        @JsonProperty("isbn") String isbn,
        @JsonProperty("publicationdate") String publicationdate
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedReview(
        @JsonProperty("id") Long id,
        @JsonProperty("bookId") Long bookId,
        @JsonProperty("reviewername") String reviewername,
        @JsonProperty("rating") Integer rating,
        @JsonProperty("comment") String comment
    ) {
    }
}

package com.williamcallahan.book_graph.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.book_graph.model.Author;

import java.util.List;
import java.util.Map;

/**
 * Author with its resolved relationship fields. {@code books} is null when not expanded;
 * {@code errors} names relationship fields that failed to resolve.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorView(
    String id,
    String firstname,
    String lastname,
    String birthdate,
    String deathdate,
    String favoriteColor,
    String bio,
    String nationality,
    String dateCreated,
    List<BookView> books,
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, String> errors
) {
    public AuthorView {
        books = books == null ? null : List.copyOf(books);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public static AuthorView of(Author author, List<BookView> books, Map<String, String> errors) {
        return new AuthorView(author.id(), author.firstname(), author.lastname(), author.birthdate(),
            author.deathdate(), author.favoriteColor(), author.bio(), author.nationality(),
            author.dateCreated(), books, errors);
    }
}

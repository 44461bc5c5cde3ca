package com.williamcallahan.book_graph.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.book_graph.model.Book;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookView(
    String id,
    String authorId,
    String title,
    String synopsis,
    String isbn,
    String publicationDate,
    AuthorView author,
    List<ReviewView> reviews,
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, String> errors
) {
    public BookView {
        reviews = reviews == null ? null : List.copyOf(reviews);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public static BookView of(Book book, AuthorView author, List<ReviewView> reviews, Map<String, String> errors) {
        return new BookView(book.id(), book.authorId(), book.title(), book.synopsis(), book.isbn(),
            book.publicationDate(), author, reviews, errors);
    }
}

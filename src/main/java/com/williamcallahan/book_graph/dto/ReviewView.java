package com.williamcallahan.book_graph.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.book_graph.model.Review;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewView(
    String id,
    String bookId,
    String reviewerName,
    int rating,
    String comment,
    BookView book,
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    Map<String, String> errors
) {
    public ReviewView {
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public static ReviewView of(Review review, BookView book, Map<String, String> errors) {
        return new ReviewView(review.id(), review.bookId(), review.reviewerName(), review.rating(),
            review.comment(), book, errors);
    }
}

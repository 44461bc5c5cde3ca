package com.williamcallahan.book_graph.dto;

public record ReviewInput(
    String bookId,
    String reviewerName,
    Integer rating,
    String comment
) {
}

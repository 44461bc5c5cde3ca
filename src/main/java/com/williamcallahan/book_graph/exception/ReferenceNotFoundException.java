package com.williamcallahan.book_graph.exception;

/**
 * A cross-store reference (book to author, review to book) points at a row that does not exist.
 */
public class ReferenceNotFoundException extends GraphOperationException {

    private final String entity;
    private final String id;

    public ReferenceNotFoundException(String entity, String id) {
        super(FailureKind.NOT_FOUND, entity + " " + id + " not found");
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public String getId() {
        return id;
    }
}

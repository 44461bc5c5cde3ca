package com.williamcallahan.book_graph.exception;

/**
 * Raised when the book store has committed a cascade but the author row could not be
 * removed afterwards. There is no automatic compensation for this state.
 */
public class CrossStoreInconsistencyException extends GraphOperationException {

    private final String authorId;

    public CrossStoreInconsistencyException(String authorId, Throwable cause) {
        super(FailureKind.INCONSISTENT,
            "Books and reviews of author " + authorId + " were deleted but the author row was not; manual reconciliation required",
            cause);
        this.authorId = authorId;
    }

    public String getAuthorId() {
        return authorId;
    }
}

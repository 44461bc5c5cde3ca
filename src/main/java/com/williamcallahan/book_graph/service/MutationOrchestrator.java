package com.williamcallahan.book_graph.service;

import com.williamcallahan.book_graph.dto.AuthorInput;
import com.williamcallahan.book_graph.dto.BookInput;
import com.williamcallahan.book_graph.dto.ReviewInput;
import com.williamcallahan.book_graph.exception.ConflictException;
import com.williamcallahan.book_graph.exception.CrossStoreInconsistencyException;
import com.williamcallahan.book_graph.exception.GraphOperationException;
import com.williamcallahan.book_graph.exception.ReferenceNotFoundException;
import com.williamcallahan.book_graph.exception.ValidationException;
import com.williamcallahan.book_graph.mapper.EntityRowMapper;
import com.williamcallahan.book_graph.model.Author;
import com.williamcallahan.book_graph.model.Book;
import com.williamcallahan.book_graph.model.Review;
import com.williamcallahan.book_graph.monitoring.MetricsService;
import com.williamcallahan.book_graph.repository.AuthorRow;
import com.williamcallahan.book_graph.repository.BookRow;
import com.williamcallahan.book_graph.repository.ReviewRow;
import com.williamcallahan.book_graph.util.AsyncUtils;
import com.williamcallahan.book_graph.util.IdentifierUtils;
import com.williamcallahan.book_graph.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Writes that span the three stores.
 *
 * <p>Input is validated before any store is touched, referential checks run against the owning
 * store, and the request's loader caches are primed or cleared so later reads in the same request
 * see the write. Failures surface through the returned future as {@link GraphOperationException}
 * subtypes.</p>
 *
 * <p>Deleting an author is not atomic across stores. Books and their reviews go first, inside one
 * book-store transaction that wraps the review-store delete; the author row goes last. A failure of
 * that last step leaves an author without books and is reported as a
 * {@link CrossStoreInconsistencyException}.</p>
 */
@Service
public class MutationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MutationOrchestrator.class);

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    private final MetricsService metricsService;
    private final Clock clock;

    public MutationOrchestrator(MetricsService metricsService, Clock clock) {
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public CompletableFuture<Author> createAuthor(AuthorInput input, RequestContext context) {
        return AsyncUtils.attempt(() -> {
            AuthorRow row = toAuthorRow(input);
            return context.supplyFromStore("authors.insert", () -> context.stores().authors().insert(row))
                .thenApply(stored -> {
                    Author author = EntityRowMapper.toAuthor(stored);
                    context.loaders().authorById().clear(stored.id()).prime(stored.id(), author);
                    context.loaders().booksByAuthorId().clear(stored.id()).prime(stored.id(), List.of());
                    log.info("[{}] Created author {}", context.getRequestId(), author.id());
                    return author;
                });
        });
    }

    public CompletableFuture<Book> createBook(BookInput input, RequestContext context) {
        return AsyncUtils.attempt(() -> {
            BookRow row = toBookRow(input);
            long authorId = row.authorId();
            return context.supplyFromStore("authors.existsById", () -> context.stores().authors().existsById(authorId))
                .thenCompose(authorExists -> {
                    if (!authorExists) {
                        throw new ReferenceNotFoundException("Author", input.authorId().trim());
                    }
                    if (row.id() == null) {
                        return CompletableFuture.completedFuture(false);
                    }
                    return context.supplyFromStore("books.existsById", () -> context.stores().books().existsById(row.id()));
                })
                .thenCompose(idTaken -> {
                    if (idTaken) {
                        throw duplicateBook(row.id());
                    }
                    return context.supplyFromStore("books.insert", () -> insertBook(context, row));
                })
                .thenApply(stored -> {
                    Book book = EntityRowMapper.toBook(stored);
                    context.loaders().bookById().clear(stored.id()).prime(stored.id(), book);
                    context.loaders().booksByAuthorId().clear(authorId);
                    context.loaders().reviewsByBookId().clear(stored.id()).prime(stored.id(), List.of());
                    log.info("[{}] Created book {} for author {}", context.getRequestId(), book.id(), authorId);
                    return book;
                });
        });
    }

    public CompletableFuture<Review> createReview(ReviewInput input, RequestContext context) {
        return AsyncUtils.attempt(() -> {
            ReviewRow row = toReviewRow(input);
            long bookId = row.bookId();
            return context.loaders().bookById().load(bookId)
                .thenCompose(book -> {
                    if (book == null) {
                        throw new ReferenceNotFoundException("Book", input.bookId().trim());
                    }
                    return context.supplyFromStore("reviews.insert", () -> context.stores().reviews().insert(row));
                })
                .thenApply(stored -> {
                    Review review = EntityRowMapper.toReview(stored);
                    context.loaders().reviewsByBookId().clear(bookId);
                    log.info("[{}] Created review {} for book {}", context.getRequestId(), review.id(), bookId);
                    return review;
                });
        });
    }

    /**
     * Deletes an author with all of its books and their reviews.
     *
     * @return future of {@code false} when no such author exists, {@code true} once everything is gone
     */
    public CompletableFuture<Boolean> deleteAuthor(String rawId, RequestContext context) {
        return AsyncUtils.attempt(() -> {
            long authorId = IdentifierUtils.requirePositiveId(rawId, "author id");
            return context.supplyFromStore("authors.existsById", () -> context.stores().authors().existsById(authorId))
                .thenCompose(exists -> {
                    if (!exists) {
                        log.info("[{}] Author {} not found; nothing deleted", context.getRequestId(), authorId);
                        return CompletableFuture.completedFuture(false);
                    }
                    return context.supplyFromStore("books.findIdsByAuthorId",
                            () -> context.stores().books().findIdsByAuthorId(authorId))
                        .thenCompose(bookIds -> deleteBooksAndReviews(bookIds, context))
                        .thenCompose(bookIds -> deleteAuthorRow(authorId, bookIds, context));
                });
        });
    }

    private CompletableFuture<List<Long>> deleteBooksAndReviews(List<Long> bookIds, RequestContext context) {
        if (bookIds.isEmpty()) {
            return CompletableFuture.completedFuture(bookIds);
        }
        return context.supplyFromStore("books.deleteWithReviews", () -> context.stores().books()
                .deleteByIdsInTransaction(bookIds, ids -> context.stores().reviews().deleteByBookIds(ids)))
            .thenApply(deleted -> {
                log.debug("[{}] Deleted {} books with their reviews", context.getRequestId(), deleted);
                return bookIds;
            });
    }

    private CompletableFuture<Boolean> deleteAuthorRow(long authorId, List<Long> bookIds, RequestContext context) {
        return context.supplyFromStore("authors.deleteById", () -> context.stores().authors().deleteById(authorId))
            .handle((removed, error) -> {
                if (error != null) {
                    Throwable cause = GraphOperationException.unwrap(error);
                    if (bookIds.isEmpty()) {
                        // no other store was touched
                        throw cause instanceof RuntimeException runtime ? runtime : new CompletionException(cause);
                    }
                    log.error("DATA INCONSISTENCY: books {} of author {} were deleted but the author row was not",
                        bookIds, authorId, cause);
                    metricsService.incrementDataInconsistency();
                    throw new CrossStoreInconsistencyException(IdentifierUtils.toExternalId(authorId), cause);
                }
                context.loaders().authorById().clear(authorId).prime(authorId, (Author) null);
                context.loaders().booksByAuthorId().clear(authorId).prime(authorId, List.of());
                for (Long bookId : bookIds) {
                    context.loaders().bookById().clear(bookId).prime(bookId, (Book) null);
                    context.loaders().reviewsByBookId().clear(bookId).prime(bookId, List.of());
                }
                log.info("[{}] Deleted author {} and {} books", context.getRequestId(), authorId, bookIds.size());
                return true;
            });
    }

    private static BookRow insertBook(RequestContext context, BookRow row) {
        try {
            return context.stores().books().insert(row);
        } catch (DuplicateKeyException ex) {
            throw duplicateBook(row.id());
        }
    }

    private static ConflictException duplicateBook(Long id) {
        return new ConflictException("Book " + id + " already exists");
    }

    // ---- validation; nothing below touches a store ----

    AuthorRow toAuthorRow(AuthorInput input) {
        if (input == null) {
            throw new ValidationException("author input is required");
        }
        String dateCreated = ValidationUtils.optionalIsoDate(input.dateCreated(), "dateCreated");
        return new AuthorRow(
            null,
            ValidationUtils.requireText(input.firstname(), "firstname"),
            ValidationUtils.requireText(input.lastname(), "lastname"),
            ValidationUtils.optionalIsoDate(input.birthdate(), "birthdate"),
            ValidationUtils.optionalIsoDate(input.deathdate(), "deathdate"),
            ValidationUtils.trimToNull(input.favoriteColor()),
            ValidationUtils.trimToNull(input.bio()),
            ValidationUtils.trimToNull(input.nationality()),
            dateCreated != null ? dateCreated : LocalDate.now(clock).toString()
        );
    }

    static BookRow toBookRow(BookInput input) {
        if (input == null) {
            throw new ValidationException("book input is required");
        }
        long authorId = IdentifierUtils.requirePositiveId(input.authorId(), "authorId");
        String title = ValidationUtils.requireText(input.title(), "title");
        Long id = ValidationUtils.hasText(input.id()) ? IdentifierUtils.requirePositiveId(input.id(), "id") : null;
        return new BookRow(
            id,
            authorId,
            title,
            ValidationUtils.trimToNull(input.synopsis()),
            ValidationUtils.trimToNull(input.isbn()),
            ValidationUtils.optionalIsoDate(input.publicationDate(), "publicationDate")
        );
    }

    static ReviewRow toReviewRow(ReviewInput input) {
        if (input == null) {
            throw new ValidationException("review input is required");
        }
        long bookId = IdentifierUtils.requirePositiveId(input.bookId(), "bookId");
        String reviewerName = ValidationUtils.requireText(input.reviewerName(), "reviewerName");
        int rating = ValidationUtils.requireRange(input.rating(), MIN_RATING, MAX_RATING, "rating");
        String comment = ValidationUtils.requireText(input.comment(), "comment");
        return new ReviewRow(null, bookId, reviewerName, rating, comment);
    }
}

package com.williamcallahan.book_graph.service;

import com.williamcallahan.book_graph.dto.AuthorView;
import com.williamcallahan.book_graph.dto.BookView;
import com.williamcallahan.book_graph.dto.ReviewView;
import com.williamcallahan.book_graph.model.Author;
import com.williamcallahan.book_graph.model.Book;
import com.williamcallahan.book_graph.model.Review;
import com.williamcallahan.book_graph.util.AsyncUtils;
import com.williamcallahan.book_graph.util.IdentifierUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Relationship field resolvers and the nested views built from them.
 *
 * <p>Every relationship goes through the request's loaders, so resolving N parents costs one bulk
 * fetch per edge rather than one query per parent. A relationship that fails is reported in the
 * view's {@code errors} map and left empty; sibling fields resolve normally.</p>
 *
 * <p>Expansion depth is fixed: author &rarr; books &rarr; reviews; book &rarr; author and reviews;
 * review &rarr; book &rarr; author.</p>
 */
@Service
public class EntityGraphResolver {

    // ---- relationship fields ----

    /**
     * {@code Author.books}: never null, empty when no book references the author.
     */
    public CompletableFuture<List<Book>> books(Author author, RequestContext context) {
        return AsyncUtils.attempt(() -> context.loaders().booksByAuthorId()
            .load(IdentifierUtils.toNumericId(author.id(), "author.id")));
    }

    /**
     * {@code Book.author}: null when the referenced author row is gone.
     */
    public CompletableFuture<Author> author(Book book, RequestContext context) {
        return AsyncUtils.attempt(() -> context.loaders().authorById()
            .load(IdentifierUtils.toNumericId(book.authorId(), "book.authorId")));
    }

    public CompletableFuture<List<Review>> reviews(Book book, RequestContext context) {
        return AsyncUtils.attempt(() -> context.loaders().reviewsByBookId()
            .load(IdentifierUtils.toNumericId(book.id(), "book.id")));
    }

    public CompletableFuture<Book> book(Review review, RequestContext context) {
        return AsyncUtils.attempt(() -> context.loaders().bookById()
            .load(IdentifierUtils.toNumericId(review.bookId(), "review.bookId")));
    }

    // ---- nested views ----

    public CompletableFuture<AuthorView> authorView(Author author, RequestContext context) {
        Map<String, String> errors = fieldErrors();
        CompletableFuture<List<BookView>> books = AsyncUtils.recoverField(books(author, context), "books", errors, List::of)
            .thenCompose(list -> AsyncUtils.sequence(mapAll(list, book -> bookWithReviews(book, context))));
        return books.thenApply(resolved -> AuthorView.of(author, resolved, errors));
    }

    public CompletableFuture<BookView> bookView(Book book, RequestContext context) {
        Map<String, String> errors = fieldErrors();
        CompletableFuture<Author> author = AsyncUtils.recoverField(author(book, context), "author", errors, () -> null);
        CompletableFuture<List<Review>> reviews = AsyncUtils.recoverField(reviews(book, context), "reviews", errors, List::of);
        return author.thenCombine(reviews, (resolvedAuthor, resolvedReviews) -> BookView.of(
            book,
            resolvedAuthor == null ? null : AuthorView.of(resolvedAuthor, null, null),
            flatReviews(resolvedReviews),
            errors));
    }

    public CompletableFuture<ReviewView> reviewView(Review review, RequestContext context) {
        Map<String, String> errors = fieldErrors();
        return AsyncUtils.recoverField(book(review, context), "book", errors, () -> null)
            .thenCompose(book -> book == null
                ? CompletableFuture.completedFuture(null)
                : bookWithAuthor(book, context))
            .thenApply(bookView -> ReviewView.of(review, bookView, errors));
    }

    public CompletableFuture<List<AuthorView>> authorViews(List<Author> authors, RequestContext context) {
        return AsyncUtils.sequence(mapAll(authors, author -> authorView(author, context)));
    }

    public CompletableFuture<List<BookView>> bookViews(List<Book> books, RequestContext context) {
        return AsyncUtils.sequence(mapAll(books, book -> bookView(book, context)));
    }

    public CompletableFuture<List<ReviewView>> reviewViews(List<Review> reviews, RequestContext context) {
        return AsyncUtils.sequence(mapAll(reviews, review -> reviewView(review, context)));
    }

    private CompletableFuture<BookView> bookWithReviews(Book book, RequestContext context) {
        Map<String, String> errors = fieldErrors();
        return AsyncUtils.recoverField(reviews(book, context), "reviews", errors, List::of)
            .thenApply(reviews -> BookView.of(book, null, flatReviews(reviews), errors));
    }

    private CompletableFuture<BookView> bookWithAuthor(Book book, RequestContext context) {
        Map<String, String> errors = fieldErrors();
        return AsyncUtils.recoverField(author(book, context), "author", errors, () -> null)
            .thenApply(author -> BookView.of(book, author == null ? null : AuthorView.of(author, null, null), null, errors));
    }

    private static List<ReviewView> flatReviews(List<Review> reviews) {
        List<ReviewView> views = new ArrayList<>(reviews.size());
        for (Review review : reviews) {
            views.add(ReviewView.of(review, null, null));
        }
        return views;
    }

    private static <T, R> List<CompletableFuture<R>> mapAll(List<T> items,
                                                           java.util.function.Function<T, CompletableFuture<R>> mapper) {
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(mapper.apply(item));
        }
        return futures;
    }

    private static Map<String, String> fieldErrors() {
        return Collections.synchronizedMap(new LinkedHashMap<>());
    }
}

package com.williamcallahan.book_graph.service;

import com.williamcallahan.book_graph.dto.AuthorView;
import com.williamcallahan.book_graph.dto.BookView;
import com.williamcallahan.book_graph.dto.ReviewView;
import com.williamcallahan.book_graph.exception.ReferenceNotFoundException;
import com.williamcallahan.book_graph.mapper.EntityRowMapper;
import com.williamcallahan.book_graph.model.Author;
import com.williamcallahan.book_graph.model.Book;
import com.williamcallahan.book_graph.model.Review;
import com.williamcallahan.book_graph.repository.AuthorRow;
import com.williamcallahan.book_graph.repository.BookRow;
import com.williamcallahan.book_graph.repository.ReviewRow;
import com.williamcallahan.book_graph.util.AsyncUtils;
import com.williamcallahan.book_graph.util.IdentifierUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Root queries: {@code authors}, {@code author(id)}, {@code books}, {@code book(id)}, {@code reviews},
 * {@code review(id)}. Lists come straight from the owning store and seed the by-id caches; single
 * entities go through the loaders. Relationships are expanded by {@link EntityGraphResolver}.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final EntityGraphResolver resolver;

    public QueryService(EntityGraphResolver resolver) {
        this.resolver = resolver;
    }

    public CompletableFuture<List<AuthorView>> authors(RequestContext context) {
        return context.supplyFromStore("authors.findAll", () -> context.stores().authors().findAll())
            .thenApply(rows -> {
                List<Author> authors = new ArrayList<>(rows.size());
                for (AuthorRow row : rows) {
                    Author author = EntityRowMapper.toAuthor(row);
                    context.loaders().authorById().clear(row.id()).prime(row.id(), author);
                    authors.add(author);
                }
                log.debug("[{}] Loaded {} authors", context.getRequestId(), authors.size());
                return authors;
            })
            .thenCompose(authors -> resolver.authorViews(authors, context));
    }

    /**
     * @throws ReferenceNotFoundException (through the future) when no author has this id
     */
    public CompletableFuture<AuthorView> author(String id, RequestContext context) {
        return AsyncUtils.attempt(() -> {
            long key = IdentifierUtils.toNumericId(id, "author id");
            return context.loaders().authorById().load(key)
                .thenCompose(author -> {
                    if (author == null) {
                        throw new ReferenceNotFoundException("Author", id);
                    }
                    return resolver.authorView(author, context);
                });
        });
    }

    public CompletableFuture<List<BookView>> books(RequestContext context) {
        return context.supplyFromStore("books.findAll", () -> context.stores().books().findAll())
            .thenApply(rows -> {
                List<Book> books = new ArrayList<>(rows.size());
                for (BookRow row : rows) {
                    Book book = EntityRowMapper.toBook(row);
                    context.loaders().bookById().clear(row.id()).prime(row.id(), book);
                    books.add(book);
                }
                return books;
            })
            .thenCompose(books -> resolver.bookViews(books, context));
    }

    public CompletableFuture<BookView> book(String id, RequestContext context) {
        return AsyncUtils.attempt(() -> {
            long key = IdentifierUtils.toNumericId(id, "book id");
            return context.loaders().bookById().load(key)
                .thenCompose(book -> {
                    if (book == null) {
                        throw new ReferenceNotFoundException("Book", id);
                    }
                    return resolver.bookView(book, context);
                });
        });
    }

    public CompletableFuture<List<ReviewView>> reviews(RequestContext context) {
        return context.supplyFromStore("reviews.findAll", () -> context.stores().reviews().findAll())
            .thenApply(QueryService::toReviews)
            .thenCompose(reviews -> resolver.reviewViews(reviews, context));
    }

    /**
     * Reviews have no by-id loader; a single review is read directly from its store.
     */
    public CompletableFuture<ReviewView> review(String id, RequestContext context) {
        return AsyncUtils.attempt(() -> {
            long key = IdentifierUtils.toNumericId(id, "review id");
            return context.supplyFromStore("reviews.findById", () -> context.stores().reviews().findById(key))
                .thenCompose(row -> {
                    Review review = row.map(EntityRowMapper::toReview)
                        .orElseThrow(() -> new ReferenceNotFoundException("Review", id));
                    return resolver.reviewView(review, context);
                });
        });
    }

    private static List<Review> toReviews(List<ReviewRow> rows) {
        List<Review> reviews = new ArrayList<>(rows.size());
        for (ReviewRow row : rows) {
            reviews.add(EntityRowMapper.toReview(row));
        }
        return reviews;
    }
}

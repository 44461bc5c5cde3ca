/**
 * Loads the authors, books and reviews seed files into their stores
 *
 * @author William Callahan
 *
 * Features:
 * - Creates missing tables before writing
 * - One upsert transaction per store, keyed by the ids in the files
 * - Realigns the book store's identity counter after explicit ids were written
 * - Retries while a store is still coming up
 * - Idempotent: a second run with the same files leaves row counts unchanged
 */

package com.williamcallahan.book_graph.seed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.book_graph.repository.AuthorRow;
import com.williamcallahan.book_graph.repository.AuthorStore;
import com.williamcallahan.book_graph.repository.BookRow;
import com.williamcallahan.book_graph.repository.BookStore;
import com.williamcallahan.book_graph.repository.ReviewRow;
import com.williamcallahan.book_graph.repository.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

@Service
public class SeedService {

    private static final Logger logger = LoggerFactory.getLogger(SeedService.class);

    static final String AUTHORS_FILE = "authors.json";
    static final String BOOKS_FILE = "books.json";
    static final String REVIEWS_FILE = "reviews.json";

    private final AuthorStore authorStore;
    private final BookStore bookStore;
    private final ReviewStore reviewStore;
    private final ObjectMapper objectMapper;
    private final RetryTemplate retryTemplate;

    public SeedService(AuthorStore authorStore,
                       BookStore bookStore,
                       ReviewStore reviewStore,
                       ObjectMapper objectMapper,
                       @Qualifier("startupRetryTemplate") RetryTemplate retryTemplate) {
        this.authorStore = authorStore;
        this.bookStore = bookStore;
        this.reviewStore = reviewStore;
        this.objectMapper = objectMapper;
        this.retryTemplate = retryTemplate;
    }

    /**
     * Row counts written per store by one seeding run.
     */
    public record SeedSummary(int authors, int books, int reviews) {
    }

    /**
     * Seeds all three stores from the files in {@code directory}, authors first.
     *
     * @throws UncheckedIOException when a seed file is missing or malformed; nothing is written in that case
     */
    public SeedSummary seed(Path directory) {
        List<AuthorRow> authors = readAuthors(directory.resolve(AUTHORS_FILE));
        List<BookRow> books = readBooks(directory.resolve(BOOKS_FILE));
        List<ReviewRow> reviews = readReviews(directory.resolve(REVIEWS_FILE));
        logger.info("Seeding from {}: {} authors, {} books, {} reviews",
            directory.toAbsolutePath(), authors.size(), books.size(), reviews.size());

        int authorCount = withRetry("seed authors", () -> {
            authorStore.createSchemaIfMissing();
            return authorStore.upsertAll(authors);
        });
        logger.info("Seeded {} authors", authorCount);

        int bookCount = withRetry("seed books", () -> {
            bookStore.createSchemaIfMissing();
            int written = bookStore.upsertAll(books);
            bookStore.realignIdentity();
            return written;
        });
        logger.info("Seeded {} books", bookCount);

        int reviewCount = withRetry("seed reviews", () -> {
            reviewStore.createSchemaIfMissing();
            return reviewStore.upsertAll(reviews);
        });
        logger.info("Seeded {} reviews", reviewCount);

        return new SeedSummary(authorCount, bookCount, reviewCount);
    }

    private <T> T withRetry(String name, Supplier<T> action) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                logger.info("Retrying {} (attempt {})", name, context.getRetryCount() + 1);
            }
            return action.get();
        });
    }

    List<AuthorRow> readAuthors(Path file) {
        List<SeedRecords.SeedAuthor> records = read(file, new TypeReference<List<SeedRecords.SeedAuthor>>() {});
        List<AuthorRow> rows = new ArrayList<>(records.size());
        for (SeedRecords.SeedAuthor author : records) {
            rows.add(new AuthorRow(requireId(author.id(), file), author.firstname(), author.lastname(),
                author.birthdate(), author.deathdate(), author.favoritecolor(), author.bio(),
                author.nationality(), author.datecreated()));
        }
        return rows;
    }

    List<BookRow> readBooks(Path file) {
        List<SeedRecords.SeedBook> records = read(file, new TypeReference<List<SeedRecords.SeedBook>>() {});
        List<BookRow> rows = new ArrayList<>(records.size());
        for (SeedRecords.SeedBook book : records) {
            rows.add(new BookRow(requireId(book.id(), file), requireId(book.authorId(), file), book.title(),
                book.synopsis(), book.isbn(), book.publicationdate()));
        }
        return rows;
    }

    List<ReviewRow> readReviews(Path file) {
        List<SeedRecords.SeedReview> records = read(file, new TypeReference<List<SeedRecords.SeedReview>>() {});
        List<ReviewRow> rows = new ArrayList<>(records.size());
        for (SeedRecords.SeedReview review : records) {
            rows.add(new ReviewRow(requireId(review.id(), file), requireId(review.bookId(), file),
                review.reviewername(), review.rating(), review.comment()));
        }
        return rows;
    }

    private <T> List<T> read(Path file, TypeReference<List<T>> type) {
        try (InputStream in = Files.newInputStream(file)) {
            List<T> records = objectMapper.readValue(in, type);
            return records == null ? List.of() : records;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed file " + file, e);
        }
    }

    private static long requireId(Long id, Path file) {
        if (id == null) {
            throw new IllegalArgumentException("Seed record without id in " + file);
        }
        return id;
    }
}

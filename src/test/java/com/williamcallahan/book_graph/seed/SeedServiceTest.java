package com.williamcallahan.book_graph.seed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.book_graph.repository.AuthorRow;
import com.williamcallahan.book_graph.repository.BookRow;
import com.williamcallahan.book_graph.testutil.InMemoryStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeedServiceTest {

    @TempDir
    Path seedDir;

    private InMemoryStores stores;
    private SeedService seedService;

    @BeforeEach
    void setUp() throws IOException {
        stores = new InMemoryStores();
        RetryTemplate retryTemplate = RetryTemplate.builder()
            .maxAttempts(3)
            .retryOn(DataAccessResourceFailureException.class)
            .noBackoff()
            .build();
        seedService = new SeedService(stores.authors, stores.books, stores.reviews, new ObjectMapper(), retryTemplate);

        Files.writeString(seedDir.resolve(SeedService.AUTHORS_FILE), """
            [
              {"id": 1, "firstname": "Ada", "lastname": "Lovelace", "birthdate": "1815-12-10",
               "deathdate": "1852-11-27", "favoritecolor": "purple", "bio": "Analyst",
               "nationality": "British", "datecreated": "2024-01-01"},
              {"id": 2, "firstname": "Grace", "lastname": "Hopper", "birthdate": "1906-12-09",
               "deathdate": null, "favoritecolor": "navy", "bio": null, "nationality": "American",
               "datecreated": "2024-01-02", "unused": true}
            ]
            """);
        Files.writeString(seedDir.resolve(SeedService.BOOKS_FILE), """
            [
              {"id": 1, "authorId": 1, "title": "Notes", "synopsis": "On the engine", "isbn": "111",
               "publicationdate": "1843-09-01"},
              {"id": 2, "authorId": 2, "title": "Compilers", "synopsis": null, "isbn": "222",
               "publicationdate": null}
            ]
            """);
        Files.writeString(seedDir.resolve(SeedService.REVIEWS_FILE), """
            [
              {"id": 1, "bookId": 1, "reviewername": "Bob", "rating": 5, "comment": "great"},
              {"id": 2, "bookId": 2, "reviewername": "Eve", "rating": 3, "comment": "fine"}
            ]
            """);
    }

    @Test
    void seed_writesEveryStoreAndRealignsBookIdentity() {
        SeedService.SeedSummary summary = seedService.seed(seedDir);

        assertThat(summary).isEqualTo(new SeedService.SeedSummary(2, 2, 2));
        assertThat(stores.calls).containsSubsequence(
            "authors.createSchemaIfMissing", "authors.upsertAll",
            "books.createSchemaIfMissing", "books.upsertAll", "books.realignIdentity",
            "reviews.createSchemaIfMissing", "reviews.upsertAll");
    }

    @Test
    void seed_twice_leavesRowCountsUnchanged() {
        seedService.seed(seedDir);
        long authors = stores.authors.count();
        long books = stores.books.count();
        long reviews = stores.reviews.count();

        seedService.seed(seedDir);

        assertThat(stores.authors.count()).isEqualTo(authors).isEqualTo(2);
        assertThat(stores.books.count()).isEqualTo(books).isEqualTo(2);
        assertThat(stores.reviews.count()).isEqualTo(reviews).isEqualTo(2);
    }

    @Test
    void readAuthors_mapsFileKeys() {
        List<AuthorRow> rows = seedService.readAuthors(seedDir.resolve(SeedService.AUTHORS_FILE));

        assertThat(rows.get(0).favoritecolor()).isEqualTo("purple");
        assertThat(rows.get(0).datecreated()).isEqualTo("2024-01-01");
        assertThat(rows.get(1).deathdate()).isNull();
    }

    @Test
    void readBooks_mapsAuthorReference() {
        List<BookRow> rows = seedService.readBooks(seedDir.resolve(SeedService.BOOKS_FILE));

        assertThat(rows).extracting(BookRow::authorId).containsExactly(1L, 2L);
        assertThat(rows.get(0).publicationdate()).isEqualTo("1843-09-01");
    }

    @Test
    void storeNotReady_isRetried() {
        stores.failNext("books.upsertAll");

        SeedService.SeedSummary summary = seedService.seed(seedDir);

        assertThat(summary.books()).isEqualTo(2);
        assertThat(stores.callCount("books.upsertAll")).isEqualTo(2);
    }

    @Test
    void missingFile_failsBeforeAnyWrite() throws IOException {
        Files.delete(seedDir.resolve(SeedService.REVIEWS_FILE));

        assertThatThrownBy(() -> seedService.seed(seedDir)).isInstanceOf(UncheckedIOException.class);
        assertThat(stores.calls).isEmpty();
    }
}

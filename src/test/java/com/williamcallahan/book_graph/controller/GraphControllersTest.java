package com.williamcallahan.book_graph.controller;

import com.williamcallahan.book_graph.monitoring.MetricsService;
import com.williamcallahan.book_graph.service.EntityGraphResolver;
import com.williamcallahan.book_graph.service.MutationOrchestrator;
import com.williamcallahan.book_graph.service.QueryService;
import com.williamcallahan.book_graph.service.RequestContextFactory;
import com.williamcallahan.book_graph.testutil.InMemoryStores;
import com.williamcallahan.book_graph.testutil.TestContexts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GraphControllersTest {

    private InMemoryStores stores;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        stores = new InMemoryStores();
        MetricsService metrics = TestContexts.metrics();
        RequestContextFactory factory = TestContexts.factory(TestContexts.gateway(stores, metrics), metrics);
        QueryService queryService = new QueryService(new EntityGraphResolver());
        MutationOrchestrator orchestrator = new MutationOrchestrator(metrics,
            Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC));

        mockMvc = MockMvcBuilders.standaloneSetup(
            new AuthorController(factory, queryService, orchestrator),
            new BookController(factory, queryService, orchestrator),
            new ReviewController(factory, queryService, orchestrator)
        ).build();

        stores.addAuthor(1, "Ada", "Lovelace");
        stores.addBook(1, 1, "Notes");
        stores.addReview(1, 1, "Bob", 5);
    }

    @Test
    @DisplayName("GET /api/authors returns nested books and reviews")
    void listAuthors_returnsTree() throws Exception {
        performAsync(get("/api/authors"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].id", equalTo("1")))
            .andExpect(jsonPath("$[0].books[0].title", equalTo("Notes")))
            .andExpect(jsonPath("$[0].books[0].reviews[0].reviewerName", equalTo("Bob")));
    }

    @Test
    void getBook_includesAuthorAndReviews() throws Exception {
        performAsync(get("/api/books/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.authorId", equalTo("1")))
            .andExpect(jsonPath("$.author.lastname", equalTo("Lovelace")))
            .andExpect(jsonPath("$.reviews[0].rating", equalTo(5)));
    }

    @Test
    void getReview_includesBookAndAuthor() throws Exception {
        performAsync(get("/api/reviews/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.book.title", equalTo("Notes")))
            .andExpect(jsonPath("$.book.author.firstname", equalTo("Ada")));
    }

    @Test
    void getAuthor_missing_is404() throws Exception {
        performAsync(get("/api/authors/9"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error", equalTo("not_found")))
            .andExpect(jsonPath("$.message", equalTo("Author 9 not found")));
    }

    @Test
    void getBook_malformedId_is400() throws Exception {
        performAsync(get("/api/books/abc"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", equalTo("validation")));
    }

    @Test
    void createAuthor_returns201() throws Exception {
        performAsync(post("/api/authors")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"firstname\":\"Grace\",\"lastname\":\"Hopper\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id", equalTo("2")))
            .andExpect(jsonPath("$.dateCreated", equalTo("2025-06-01")));
    }

    @Test
    void createBook_duplicateId_is409() throws Exception {
        performAsync(post("/api/books")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"id\":\"1\",\"authorId\":\"1\",\"title\":\"Again\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    void createReview_outOfRangeRating_is400() throws Exception {
        performAsync(post("/api/reviews")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"bookId\":\"1\",\"reviewerName\":\"Eve\",\"rating\":6,\"comment\":\"too much\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", equalTo("rating must be between 1 and 5")));
    }

    @Test
    void deleteAuthor_reportsDeletedFlag() throws Exception {
        performAsync(delete("/api/authors/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted", equalTo(true)));
        performAsync(delete("/api/authors/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted", equalTo(false)));
    }

    @Test
    void storeOutage_is502() throws Exception {
        stores.failOn("reviews.findAll");

        performAsync(get("/api/reviews"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.message", startsWith("reviews.findAll failed")));
    }

    private ResultActions performAsync(MockHttpServletRequestBuilder builder) throws Exception {
        MvcResult result = mockMvc.perform(builder)
            .andExpect(request().asyncStarted())
            .andReturn();
        return mockMvc.perform(asyncDispatch(result));
    }
}

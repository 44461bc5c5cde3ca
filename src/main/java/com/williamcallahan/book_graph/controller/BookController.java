/**
 * REST controller for books with their author and reviews.
 */
package com.williamcallahan.book_graph.controller;

import com.williamcallahan.book_graph.controller.support.GraphResponses;
import com.williamcallahan.book_graph.dto.BookInput;
import com.williamcallahan.book_graph.service.MutationOrchestrator;
import com.williamcallahan.book_graph.service.QueryService;
import com.williamcallahan.book_graph.service.RequestContext;
import com.williamcallahan.book_graph.service.RequestContextFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/books")
public class BookController {
    private final RequestContextFactory contextFactory;
    private final QueryService queryService;
    private final MutationOrchestrator mutationOrchestrator;

    public BookController(RequestContextFactory contextFactory,
                          QueryService queryService,
                          MutationOrchestrator mutationOrchestrator) {
        this.contextFactory = contextFactory;
        this.queryService = queryService;
        this.mutationOrchestrator = mutationOrchestrator;
    }

    @GetMapping
    public Mono<ResponseEntity<?>> listBooks() {
        RequestContext context = contextFactory.open();
        return GraphResponses.ok(context.run(() -> queryService.books(context)), "Failed to list books");
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<?>> getBook(@PathVariable String id) {
        RequestContext context = contextFactory.open();
        return GraphResponses.ok(
            context.run(() -> queryService.book(id, context)),
            String.format("Failed to fetch book '%s'", id)
        );
    }

    /**
     * Creates a book. An {@code id} in the body is used as given and must not exist yet.
     */
    @PostMapping
    public Mono<ResponseEntity<?>> createBook(@RequestBody BookInput input) {
        RequestContext context = contextFactory.open();
        return GraphResponses.mutation(
            context.run(() -> mutationOrchestrator.createBook(input, context)),
            HttpStatus.CREATED,
            "Failed to create book"
        );
    }
}

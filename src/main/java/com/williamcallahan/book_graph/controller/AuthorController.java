/**
 * REST controller for authors, their books and their books' reviews.
 */
package com.williamcallahan.book_graph.controller;

import com.williamcallahan.book_graph.controller.support.GraphResponses;
import com.williamcallahan.book_graph.dto.AuthorInput;
import com.williamcallahan.book_graph.service.MutationOrchestrator;
import com.williamcallahan.book_graph.service.QueryService;
import com.williamcallahan.book_graph.service.RequestContext;
import com.williamcallahan.book_graph.service.RequestContextFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/authors")
@Slf4j
public class AuthorController {
    private final RequestContextFactory contextFactory;
    private final QueryService queryService;
    private final MutationOrchestrator mutationOrchestrator;

    public AuthorController(RequestContextFactory contextFactory,
                            QueryService queryService,
                            MutationOrchestrator mutationOrchestrator) {
        this.contextFactory = contextFactory;
        this.queryService = queryService;
        this.mutationOrchestrator = mutationOrchestrator;
    }

    @GetMapping
    public Mono<ResponseEntity<?>> listAuthors() {
        RequestContext context = contextFactory.open();
        return GraphResponses.ok(context.run(() -> queryService.authors(context)), "Failed to list authors");
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<?>> getAuthor(@PathVariable String id) {
        RequestContext context = contextFactory.open();
        return GraphResponses.ok(
            context.run(() -> queryService.author(id, context)),
            String.format("Failed to fetch author '%s'", id)
        );
    }

    @PostMapping
    public Mono<ResponseEntity<?>> createAuthor(@RequestBody AuthorInput input) {
        RequestContext context = contextFactory.open();
        return GraphResponses.mutation(
            context.run(() -> mutationOrchestrator.createAuthor(input, context)),
            HttpStatus.CREATED,
            "Failed to create author"
        );
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<?>> deleteAuthor(@PathVariable String id) {
        RequestContext context = contextFactory.open();
        log.info("[{}] Delete requested for author '{}'", context.getRequestId(), id);
        return GraphResponses.mutation(
            context.run(() -> mutationOrchestrator.deleteAuthor(id, context))
                .thenApply(deleted -> Map.of("deleted", deleted)),
            HttpStatus.OK,
            String.format("Failed to delete author '%s'", id)
        );
    }
}

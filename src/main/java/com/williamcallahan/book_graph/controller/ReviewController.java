package com.williamcallahan.book_graph.controller;

import com.williamcallahan.book_graph.controller.support.GraphResponses;
import com.williamcallahan.book_graph.dto.ReviewInput;
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
@RequestMapping("/api/reviews")
public class ReviewController {
    private final RequestContextFactory contextFactory;
    private final QueryService queryService;
    private final MutationOrchestrator mutationOrchestrator;

    public ReviewController(RequestContextFactory contextFactory,
                            QueryService queryService,
                            MutationOrchestrator mutationOrchestrator) {
        this.contextFactory = contextFactory;
        this.queryService = queryService;
        this.mutationOrchestrator = mutationOrchestrator;
    }

    @GetMapping
    public Mono<ResponseEntity<?>> listReviews() {
        RequestContext context = contextFactory.open();
        return GraphResponses.ok(context.run(() -> queryService.reviews(context)), "Failed to list reviews");
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<?>> getReview(@PathVariable String id) {
        RequestContext context = contextFactory.open();
        return GraphResponses.ok(
            context.run(() -> queryService.review(id, context)),
            String.format("Failed to fetch review '%s'", id)
        );
    }

    @PostMapping
    public Mono<ResponseEntity<?>> createReview(@RequestBody ReviewInput input) {
        RequestContext context = contextFactory.open();
        return GraphResponses.mutation(
            context.run(() -> mutationOrchestrator.createReview(input, context)),
            HttpStatus.CREATED,
            "Failed to create review"
        );
    }
}

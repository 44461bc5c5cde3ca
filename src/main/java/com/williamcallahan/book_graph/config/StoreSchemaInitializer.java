package com.williamcallahan.book_graph.config;

import com.williamcallahan.book_graph.repository.AuthorStore;
import com.williamcallahan.book_graph.repository.BookStore;
import com.williamcallahan.book_graph.repository.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates missing tables in all three stores once the application is up.
 * Enabled with {@code app.stores.initialize-schema=true}.
 */
@Component
@ConditionalOnProperty(prefix = "app.stores", name = "initialize-schema", havingValue = "true")
public class StoreSchemaInitializer {

    private static final Logger logger = LoggerFactory.getLogger(StoreSchemaInitializer.class);

    private final AuthorStore authorStore;
    private final BookStore bookStore;
    private final ReviewStore reviewStore;
    private final RetryTemplate retryTemplate;

    public StoreSchemaInitializer(AuthorStore authorStore,
                                  BookStore bookStore,
                                  ReviewStore reviewStore,
                                  @Qualifier("startupRetryTemplate") RetryTemplate retryTemplate) {
        this.authorStore = authorStore;
        this.bookStore = bookStore;
        this.reviewStore = reviewStore;
        this.retryTemplate = retryTemplate;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeSchemas() {
        retryTemplate.execute(context -> {
            authorStore.createSchemaIfMissing();
            return null;
        });
        retryTemplate.execute(context -> {
            bookStore.createSchemaIfMissing();
            return null;
        });
        retryTemplate.execute(context -> {
            reviewStore.createSchemaIfMissing();
            return null;
        });
        logger.info("Store schemas verified");
    }
}

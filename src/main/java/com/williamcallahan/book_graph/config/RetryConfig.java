/**
 * Configuration for retry mechanisms on startup-adjacent store paths
 *
 * @author William Callahan
 *
 * Features:
 * - Retries connection-level failures while stores are still coming up (seeding, schema setup)
 * - Implements exponential backoff with jitter for transient failures
 * - Request-serving paths are never retried
 */

package com.williamcallahan.book_graph.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.HashMap;
import java.util.Map;

@Configuration
public class RetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(RetryConfig.class);

    @Value("${app.retry.startup.max-attempts:30}")
    private int startupMaxAttempts;

    @Value("${app.retry.startup.initial-backoff-ms:2000}")
    private long startupInitialBackoff;

    @Value("${app.retry.startup.max-backoff-ms:10000}")
    private long startupMaxBackoff;

    @Value("${app.retry.startup.backoff-multiplier:1.0}")
    private double startupBackoffMultiplier;

    /**
     * Custom ExponentialBackOffPolicy with jitter to prevent thundering herd
     */
    static class ExponentialBackOffWithJitterPolicy implements BackOffPolicy {
        private static final Logger logger = LoggerFactory.getLogger(ExponentialBackOffWithJitterPolicy.class);
        private long initialInterval = 1000;
        private double multiplier = 2.0;
        private long maxInterval = 10000;
        private final double jitterFactor = 0.2; // 20% jitter

        public void setInitialInterval(long initialInterval) {
            this.initialInterval = initialInterval;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public void setMaxInterval(long maxInterval) {
            this.maxInterval = maxInterval;
        }

        private static class BackOffContextImpl implements BackOffContext {
            long currentInterval;
        }

        @Override
        public BackOffContext start(RetryContext context) {
            BackOffContextImpl ctx = new BackOffContextImpl();
            ctx.currentInterval = this.initialInterval;
            return ctx;
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            BackOffContextImpl ctx = (BackOffContextImpl) backOffContext;
            long sleepTime = ctx.currentInterval;
            long jitter = (long) (sleepTime * jitterFactor * (2 * Math.random() - 1));
            sleepTime = Math.max(1, sleepTime + jitter);
            if (logger.isDebugEnabled()) {
                logger.debug("Backing off for {}ms (with jitter)", sleepTime);
            }
            try {
                Thread.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Thread interrupted while backing off", e);
            }
            long nextInterval = (long) (ctx.currentInterval * multiplier);
            ctx.currentInterval = Math.min(nextInterval, maxInterval);
        }
    }

    /**
     * Retry template for seeding and schema setup, where a store may still be starting.
     * Only connection-level and transient failures are retried.
     *
     * @return RetryTemplate for startup store operations
     */
    @Bean("startupRetryTemplate")
    public RetryTemplate startupRetryTemplate() {
        RetryTemplate retryTemplate = new RetryTemplate();

        Map<Class<? extends Throwable>, Boolean> retryableExceptions = new HashMap<>();
        retryableExceptions.put(DataAccessResourceFailureException.class, true);
        retryableExceptions.put(TransientDataAccessException.class, true);

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(startupMaxAttempts, retryableExceptions, true);
        retryTemplate.setRetryPolicy(retryPolicy);

        ExponentialBackOffWithJitterPolicy backOffPolicy = new ExponentialBackOffWithJitterPolicy();
        backOffPolicy.setInitialInterval(startupInitialBackoff);
        backOffPolicy.setMultiplier(startupBackoffMultiplier);
        backOffPolicy.setMaxInterval(startupMaxBackoff);
        retryTemplate.setBackOffPolicy(backOffPolicy);

        retryTemplate.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                logger.warn("Store not ready (attempt {}/{}): {}",
                    context.getRetryCount(), startupMaxAttempts, throwable.getMessage());
            }
        });
        return retryTemplate;
    }
}

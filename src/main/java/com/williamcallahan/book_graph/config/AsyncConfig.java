/**
 * Executors for request resolution and store I/O
 *
 * @author William Callahan
 *
 * Features:
 * - Shared pool that per-request schedulers run their serialized task queues on
 * - Separate pool for blocking JDBC calls so request timelines never wait on I/O
 * - Descriptive thread naming for monitoring
 */

package com.williamcallahan.book_graph.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Pool that drains per-request {@code RequestScheduler} queues. Work on it is CPU-only:
     * resolving fields, distributing batch results, composing futures.
     */
    @Bean("resolverExecutor")
    public AsyncTaskExecutor resolverExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int processors = Runtime.getRuntime().availableProcessors();
        executor.setCorePoolSize(Math.max(2, processors));
        executor.setMaxPoolSize(Math.max(4, processors * 2));
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("resolver-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Pool for blocking store calls, sized above the sum of the connection pools.
     */
    @Bean("storeExecutor")
    public AsyncTaskExecutor storeExecutor(@Value("${app.stores.executor.core-size:20}") int coreSize,
                                           @Value("${app.stores.executor.max-size:50}") int maxSize,
                                           @Value("${app.stores.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("store-io-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}

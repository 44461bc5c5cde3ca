/**
 * Service for tracking aggregation-layer metrics
 * Provides counters and timers for batch loading and store access
 *
 * @author William Callahan
 */

package com.williamcallahan.book_graph.monitoring;

import com.williamcallahan.book_graph.loader.LoaderListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
public class MetricsService implements LoaderListener {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter dataInconsistencies;
    private final Counter storeErrors;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.dataInconsistencies = Counter.builder("graph.data_inconsistencies")
            .description("Author deletions that left books removed but the author row in place")
            .register(meterRegistry);

        this.storeErrors = Counter.builder("graph.store.errors")
            .description("Number of failed store calls")
            .register(meterRegistry);
    }

    @Override
    public void onBatch(String loaderName, int keyCount) {
        meterRegistry.counter("graph.loader.batches", "loader", loaderName).increment();
        meterRegistry.counter("graph.loader.keys", "loader", loaderName).increment(keyCount);
    }

    @Override
    public void onBatchFailure(String loaderName, int keyCount, Throwable error) {
        meterRegistry.counter("graph.loader.batch_failures", "loader", loaderName).increment();
    }

    public void incrementDataInconsistency() {
        dataInconsistencies.increment();
    }

    public void incrementStoreError() {
        storeErrors.increment();
    }

    /**
     * Times one store call under {@code graph.store.operation.duration}, tagged with the operation name.
     */
    public <T> T recordStoreCall(String operation, Supplier<T> call) {
        Timer timer = Timer.builder("graph.store.operation.duration")
            .tag("operation", operation)
            .register(meterRegistry);
        return timer.record(call);
    }
}

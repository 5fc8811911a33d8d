package com.fanfic.ingest.service.config;

import com.fanfic.ingest.service.ingest.DispatchOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Metrics configuration for Fanfic Ingest Service.
 *
 * Provides custom metrics for folder extraction, dispatch and the poll loop.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Extraction counters
    private final Counter filesConsumed;
    private final Counter filesSkipped;
    private final Counter filesFailed;

    // Poll loop
    private final Counter cyclesCompleted;
    private final Counter cyclesFailed;
    private final Timer cycleTimer;

    private final Map<DispatchOutcome, Counter> dispatchCounters = new EnumMap<>(DispatchOutcome.class);

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.filesConsumed = Counter.builder("fanfic.folder.files.consumed")
                .description("Number of URL files read and removed")
                .register(registry);

        this.filesSkipped = Counter.builder("fanfic.folder.files.skipped")
                .description("Number of URL files left in place because they were empty")
                .register(registry);

        this.filesFailed = Counter.builder("fanfic.folder.files.failed")
                .description("Number of URL files that could not be read or removed")
                .register(registry);

        this.cyclesCompleted = Counter.builder("fanfic.watcher.cycles")
                .description("Number of poll cycles run")
                .register(registry);

        this.cyclesFailed = Counter.builder("fanfic.watcher.cycles.failed")
                .description("Number of poll cycles whose folder scan failed")
                .register(registry);

        this.cycleTimer = Timer.builder("fanfic.watcher.cycle.duration")
                .description("Time taken for one poll cycle")
                .register(registry);

        for (DispatchOutcome outcome : DispatchOutcome.values()) {
            dispatchCounters.put(outcome, Counter.builder("fanfic.dispatch.count")
                    .description("Number of URLs dispatched, by outcome")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(registry));
        }
    }

    /**
     * Counts one dispatched item under its outcome.
     *
     * @param outcome what happened to the item
     */
    public void recordDispatch(DispatchOutcome outcome) {
        dispatchCounters.get(outcome).increment();
    }

    /**
     * Registers a gauge for queue depth monitoring.
     *
     * @param name the metric name
     * @param site the site the queue belongs to
     * @param sizeSupplier supplier for the current size
     */
    public void registerQueueGauge(String name, String site, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description("Current depth of a site queue")
                .tag("site", site)
                .register(registry);
    }
}

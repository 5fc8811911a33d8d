package com.fanfic.ingest.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the per-site destination queues.
 *
 * Controls which sites get a dedicated queue, queue sizes and enqueue timeouts.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fanfic.ingest")
public class IngestionConfig {

    /**
     * Site identifiers that get a dedicated queue. The fallback "other"
     * queue is always created in addition to these.
     */
    private List<String> sites = new ArrayList<>();

    /**
     * Queue configuration.
     */
    @Valid
    private QueueConfig queue = new QueueConfig();

    @Getter
    @Setter
    public static class QueueConfig {

        /**
         * Maximum capacity of each site queue (default: 1,000).
         */
        @Positive
        private int capacity = 1000;

        /**
         * Queue utilization threshold reported as DOWN by the health check (percentage).
         */
        private int backpressureThreshold = 100;

        /**
         * How long an enqueue may block on a full queue, in milliseconds.
         */
        private long enqueueTimeoutMs = 5000;
    }
}

package com.fanfic.ingest.service.api.health;

import com.fanfic.ingest.service.config.IngestionConfig;
import com.fanfic.ingest.service.ingest.DestinationRegistry;
import com.fanfic.ingest.service.ingest.SiteQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the per-site queues.
 *
 * Reports each queue's depth; DOWN when any queue reaches the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class SiteQueuesHealthIndicator implements HealthIndicator {

    private final DestinationRegistry destinations;
    private final IngestionConfig config;

    @Override
    public Health health() {
        int threshold = config.getQueue().getBackpressureThreshold();
        boolean saturated = false;
        Map<String, Object> details = new LinkedHashMap<>();

        for (SiteQueue queue : destinations.all()) {
            int utilization = queue.getUtilizationPercent();
            saturated |= utilization >= threshold;
            details.put(queue.getSite(), Map.of(
                    "size", queue.size(),
                    "capacity", queue.getCapacity(),
                    "utilizationPercent", utilization
            ));
        }

        Health.Builder builder = saturated ? Health.down() : Health.up();
        return builder
                .withDetail("backpressureThreshold", threshold)
                .withDetails(details)
                .build();
    }
}

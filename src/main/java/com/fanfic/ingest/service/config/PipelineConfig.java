package com.fanfic.ingest.service.config;

import com.fanfic.ingest.service.ingest.BoundedSiteQueue;
import com.fanfic.ingest.service.ingest.DestinationRegistry;
import com.fanfic.ingest.service.ingest.SiteQueue;
import com.fanfic.ingest.service.notify.LoggingNotifier;
import com.fanfic.ingest.service.notify.Notifier;
import com.fanfic.ingest.service.notify.WebhookNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Wires the pipeline's destinations: one bounded queue per configured site
 * plus the fallback queue, and the notifier used for diverted sites.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class PipelineConfig {

    private final IngestionConfig ingestionConfig;
    private final NotificationConfig notificationConfig;
    private final MetricsConfig metricsConfig;

    // ==================== Destinations ====================

    @Bean
    public DestinationRegistry destinationRegistry() {
        int capacity = ingestionConfig.getQueue().getCapacity();
        Map<String, SiteQueue> queues = new LinkedHashMap<>();

        for (String site : ingestionConfig.getSites()) {
            String key = site.trim().toLowerCase(Locale.ROOT);
            if (!key.isEmpty()) {
                queues.putIfAbsent(key, new BoundedSiteQueue(key, capacity));
            }
        }
        queues.putIfAbsent(DestinationRegistry.FALLBACK_SITE,
                new BoundedSiteQueue(DestinationRegistry.FALLBACK_SITE, capacity));

        queues.values().forEach(queue -> metricsConfig.registerQueueGauge(
                "fanfic.queue.size", queue.getSite(), queue::size));

        log.info("Site queues initialized: {} (capacity {} each)", queues.keySet(), capacity);
        return new DestinationRegistry(queues);
    }

    // ==================== Notification ====================

    @Bean
    public Notifier notifier(RestTemplateBuilder restTemplateBuilder) {
        if (notificationConfig.isWebhookConfigured()) {
            log.info("Notifications will be posted to webhook: {}", notificationConfig.getWebhookUrl());
            return new WebhookNotifier(notificationConfig, restTemplateBuilder);
        }
        log.info("No notification webhook configured, notifications will be logged only");
        return new LoggingNotifier();
    }
}

package com.fanfic.ingest.service.ingest;

import com.fanfic.ingest.service.classify.FanficSite;
import com.fanfic.ingest.service.classify.SiteClassification;
import com.fanfic.ingest.service.classify.UrlClassifier;
import com.fanfic.ingest.service.config.FolderWatcherConfig;
import com.fanfic.ingest.service.config.IngestionConfig;
import com.fanfic.ingest.service.config.MetricsConfig;
import com.fanfic.ingest.service.notify.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Routes extracted URLs to their destination.
 *
 * Each item ends in exactly one place: its site queue, the fallback queue,
 * the notifier (for a diverted site), or a logged drop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UrlDispatcher {

    static final String NOTIFICATION_TITLE = "New Fanfiction Download";
    static final String DIVERTIBLE_SITE = FanficSite.FANFICTION_NET.getId();

    private final UrlClassifier classifier;
    private final DestinationRegistry destinations;
    private final Notifier notifier;
    private final FolderWatcherConfig watcherConfig;
    private final IngestionConfig ingestionConfig;
    private final MetricsConfig metricsConfig;

    /**
     * Classifies and delivers one item.
     *
     * @param item an unclassified item from the extractor
     * @return what happened to the item
     */
    public DispatchOutcome dispatch(UrlItem item) {
        DispatchOutcome outcome = route(item);
        metricsConfig.recordDispatch(outcome);
        return outcome;
    }

    private DispatchOutcome route(UrlItem item) {
        UrlItem classified;
        try {
            classified = classify(item);
        } catch (IngestionException e) {
            log.debug("Dropping unclassifiable URL {}: {} [{}]", item.rawUrl(), e.getMessage(), e.getErrorCode());
            return DispatchOutcome.DROPPED_UNCLASSIFIABLE;
        }
        log.debug("Identified site for {}: {}", item.rawUrl(), classified.site());

        if (isDiverted(classified.site())) {
            sendNotification(classified);
            return DispatchOutcome.NOTIFIED;
        }

        Optional<SiteQueue> destination = destinations.resolve(classified.site());
        if (destination.isEmpty()) {
            log.debug("No queue available for site: {}", classified.site());
            return DispatchOutcome.DROPPED_NO_DESTINATION;
        }
        return enqueue(destination.get(), classified);
    }

    // ==================== Steps ====================

    private UrlItem classify(UrlItem item) {
        SiteClassification classification = classifier.classify(item.rawUrl(), watcherConfig.isClassifierVerbose());
        return item.classified(classification.site(), classification.normalizedUrl());
    }

    private boolean isDiverted(String site) {
        return watcherConfig.isFfnetDisable() && DIVERTIBLE_SITE.equals(site);
    }

    private void sendNotification(UrlItem item) {
        try {
            notifier.notify(NOTIFICATION_TITLE, item.normalizedUrl(), item.site());
            log.info("{} notification sent: {}", item.site(), item.normalizedUrl());
        } catch (RuntimeException e) {
            log.warn("Notification failed for {}: {}", item.normalizedUrl(), e.getMessage());
        }
    }

    private DispatchOutcome enqueue(SiteQueue queue, UrlItem item) {
        boolean enqueued = queue.enqueue(item, ingestionConfig.getQueue().getEnqueueTimeoutMs());
        if (!enqueued) {
            log.warn("Could not queue URL for {} on queue {}, dropping: {}",
                    item.site(), queue.getSite(), item.normalizedUrl());
            return DispatchOutcome.DROPPED_ENQUEUE_FAILED;
        }
        log.info("Queued URL for {}: {}", item.site(), item.normalizedUrl());
        return DispatchOutcome.QUEUED;
    }
}

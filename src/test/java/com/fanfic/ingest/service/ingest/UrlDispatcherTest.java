package com.fanfic.ingest.service.ingest;

import com.fanfic.ingest.service.classify.RegexUrlClassifier;
import com.fanfic.ingest.service.classify.SiteClassification;
import com.fanfic.ingest.service.classify.UrlClassifier;
import com.fanfic.ingest.service.config.FolderWatcherConfig;
import com.fanfic.ingest.service.config.IngestionConfig;
import com.fanfic.ingest.service.config.MetricsConfig;
import com.fanfic.ingest.service.notify.Notifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class UrlDispatcherTest {

    private static final String AO3 = "archiveofourown.org";
    private static final String FFNET = "fanfiction.net";

    private BoundedSiteQueue ao3Queue;
    private BoundedSiteQueue ffnetQueue;
    private BoundedSiteQueue otherQueue;
    private Notifier notifier;
    private FolderWatcherConfig watcherConfig;
    private IngestionConfig ingestionConfig;
    private MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        ao3Queue = new BoundedSiteQueue(AO3, 10);
        ffnetQueue = new BoundedSiteQueue(FFNET, 10);
        otherQueue = new BoundedSiteQueue(DestinationRegistry.FALLBACK_SITE, 10);
        notifier = mock(Notifier.class);

        watcherConfig = new FolderWatcherConfig();
        watcherConfig.setFolderPath("unused");
        ingestionConfig = new IngestionConfig();
        ingestionConfig.getQueue().setEnqueueTimeoutMs(10);
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
    }

    // ==================== Routing ====================

    @Test
    @DisplayName("Exact site key wins over the fallback queue")
    void routesToExactSiteQueue() {
        UrlDispatcher dispatcher = dispatcher(Map.of(AO3, ao3Queue, "other", otherQueue));

        DispatchOutcome outcome = dispatcher.dispatch(item("https://archiveofourown.org/works/123/chapters/456"));

        assertThat(outcome).isEqualTo(DispatchOutcome.QUEUED);
        assertThat(otherQueue.size()).isZero();
        assertThat(ao3Queue.dequeue(0)).get().satisfies(queued -> {
            assertThat(queued.site()).isEqualTo(AO3);
            assertThat(queued.normalizedUrl()).isEqualTo("https://archiveofourown.org/works/123");
            assertThat(queued.sourceFile()).isNull();
        });
    }

    @Test
    void siteWithoutQueueFallsBackToOther() {
        UrlDispatcher dispatcher = dispatcher(Map.of(AO3, ao3Queue, "other", otherQueue));

        DispatchOutcome outcome = dispatcher.dispatch(item("https://fanfiction.net/s/456"));

        assertThat(outcome).isEqualTo(DispatchOutcome.QUEUED);
        assertThat(ao3Queue.size()).isZero();
        assertThat(otherQueue.dequeue(0)).get()
                .extracting(UrlItem::site)
                .isEqualTo(FFNET);
    }

    @Test
    void unknownSiteFallsBackToOther() {
        UrlDispatcher dispatcher = dispatcher(Map.of(AO3, ao3Queue, "other", otherQueue));

        dispatcher.dispatch(item("https://example.com/story/1"));

        assertThat(otherQueue.dequeue(0)).get().satisfies(queued -> {
            assertThat(queued.site()).isEqualTo("other");
            assertThat(queued.normalizedUrl()).isEqualTo("https://example.com/story/1");
        });
    }

    @Test
    void noMatchingAndNoFallbackQueueDropsItem() {
        UrlDispatcher dispatcher = dispatcher(Map.of(AO3, ao3Queue));

        DispatchOutcome outcome = dispatcher.dispatch(item("https://example.com/story/1"));

        assertThat(outcome).isEqualTo(DispatchOutcome.DROPPED_NO_DESTINATION);
        assertThat(ao3Queue.size()).isZero();
        verifyNoInteractions(notifier);
    }

    @Test
    void fullQueueDropsItemInsteadOfBlockingForever() {
        BoundedSiteQueue tiny = new BoundedSiteQueue(AO3, 1);
        UrlDispatcher dispatcher = dispatcher(Map.of(AO3, tiny, "other", otherQueue));

        assertThat(dispatcher.dispatch(item("https://archiveofourown.org/works/1"))).isEqualTo(DispatchOutcome.QUEUED);
        assertThat(dispatcher.dispatch(item("https://archiveofourown.org/works/2")))
                .isEqualTo(DispatchOutcome.DROPPED_ENQUEUE_FAILED);

        assertThat(tiny.size()).isEqualTo(1);
        assertThat(otherQueue.size()).isZero();
    }

    // ==================== Diversion ====================

    @Test
    @DisplayName("Diverted site goes to the notifier only, even when it has a queue")
    void divertedSiteIsNotifiedAndNotQueued() {
        watcherConfig.setFfnetDisable(true);
        UrlDispatcher dispatcher = dispatcher(Map.of(FFNET, ffnetQueue, "other", otherQueue));

        DispatchOutcome outcome = dispatcher.dispatch(item("https://m.fanfiction.net/s/456/3/Some-Title"));

        assertThat(outcome).isEqualTo(DispatchOutcome.NOTIFIED);
        verify(notifier).notify(UrlDispatcher.NOTIFICATION_TITLE, "https://www.fanfiction.net/s/456/1/", FFNET);
        assertThat(ffnetQueue.size()).isZero();
        assertThat(otherQueue.size()).isZero();
    }

    @Test
    void divertedSiteIsQueuedWhenFlagIsOff() {
        UrlDispatcher dispatcher = dispatcher(Map.of(FFNET, ffnetQueue, "other", otherQueue));

        DispatchOutcome outcome = dispatcher.dispatch(item("https://www.fanfiction.net/s/456"));

        assertThat(outcome).isEqualTo(DispatchOutcome.QUEUED);
        assertThat(ffnetQueue.size()).isEqualTo(1);
        verifyNoInteractions(notifier);
    }

    @Test
    void flagDoesNotDivertOtherSites() {
        watcherConfig.setFfnetDisable(true);
        UrlDispatcher dispatcher = dispatcher(Map.of(AO3, ao3Queue, "other", otherQueue));

        assertThat(dispatcher.dispatch(item("https://archiveofourown.org/works/7"))).isEqualTo(DispatchOutcome.QUEUED);
        assertThat(ao3Queue.size()).isEqualTo(1);
        verifyNoInteractions(notifier);
    }

    @Test
    void notifierFailureDoesNotEscapeOrFallThroughToQueue() {
        watcherConfig.setFfnetDisable(true);
        doThrow(new IllegalStateException("smtp down")).when(notifier).notify(anyString(), anyString(), anyString());
        UrlDispatcher dispatcher = dispatcher(Map.of(FFNET, ffnetQueue, "other", otherQueue));

        DispatchOutcome outcome = dispatcher.dispatch(item("https://www.fanfiction.net/s/456"));

        assertThat(outcome).isEqualTo(DispatchOutcome.NOTIFIED);
        assertThat(ffnetQueue.size()).isZero();
        assertThat(otherQueue.size()).isZero();
    }

    // ==================== Classification ====================

    @Test
    void unparseableUrlIsDropped() {
        UrlDispatcher dispatcher = dispatcher(Map.of(AO3, ao3Queue, "other", otherQueue));

        DispatchOutcome outcome = dispatcher.dispatch(item("not a url at all"));

        assertThat(outcome).isEqualTo(DispatchOutcome.DROPPED_UNCLASSIFIABLE);
        assertThat(ao3Queue.size()).isZero();
        assertThat(otherQueue.size()).isZero();
        assertThat(metricsConfig.getDispatchCounters().get(DispatchOutcome.DROPPED_UNCLASSIFIABLE).count())
                .isEqualTo(1.0);
    }

    @Test
    void verboseFlagIsPassedToClassifier() {
        watcherConfig.setClassifierVerbose(true);
        UrlClassifier classifier = mock(UrlClassifier.class);
        when(classifier.classify(anyString(), anyBoolean()))
                .thenReturn(new SiteClassification(AO3, "https://archiveofourown.org/works/1"));
        UrlDispatcher dispatcher = new UrlDispatcher(classifier,
                new DestinationRegistry(Map.of(AO3, ao3Queue)),
                notifier, watcherConfig, ingestionConfig, metricsConfig);

        dispatcher.dispatch(item("https://archiveofourown.org/works/1"));

        verify(classifier).classify("https://archiveofourown.org/works/1", true);
    }

    // ==================== Helpers ====================

    private UrlDispatcher dispatcher(Map<String, SiteQueue> queues) {
        return new UrlDispatcher(new RegexUrlClassifier(), new DestinationRegistry(queues),
                notifier, watcherConfig, ingestionConfig, metricsConfig);
    }

    private static UrlItem item(String url) {
        return new UrlItem(url, "test.url");
    }
}

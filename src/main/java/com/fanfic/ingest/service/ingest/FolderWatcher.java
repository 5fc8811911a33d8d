package com.fanfic.ingest.service.ingest;

import com.fanfic.ingest.service.config.FolderWatcherConfig;
import com.fanfic.ingest.service.config.MetricsConfig;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Poll loop that drives the extractor and the dispatcher.
 *
 * Runs on one dedicated thread: extract the folder, dispatch every item, then
 * wait for the poll interval. Failures are isolated per item and per cycle so
 * the loop only ends when the service is stopped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FolderWatcher {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final UrlExtractor extractor;
    private final UrlDispatcher dispatcher;
    private final FolderWatcherConfig config;
    private final MetricsConfig metricsConfig;

    private ExecutorService executorService;
    private CountDownLatch stopSignal;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private volatile CycleResult lastCycle;

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        if (!config.isEnabled()) {
            log.info("Folder watcher disabled, not watching: {}", config.getFolderPath());
            return;
        }
        start();
    }

    /**
     * Starts the poll loop on its own thread. Does nothing if already running.
     */
    public synchronized void start() {
        if (running.get()) {
            return;
        }
        stopSignal = new CountDownLatch(1);
        executorService = Executors.newSingleThreadExecutor(this::createWatcherThread);
        running.set(true);
        executorService.submit(this::watchLoop);
        logStartup();
    }

    /**
     * Stops the poll loop. A cycle in progress runs to completion; the wait
     * between cycles ends immediately.
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        stopSignal.countDown();
        shutdownExecutor();
        log.info("Folder watcher stopped after {} cycles", cyclesCompleted.get());
    }

    private void shutdownExecutor() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of folder watcher after {} seconds", SHUTDOWN_TIMEOUT_SECONDS);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    private Thread createWatcherThread(Runnable runnable) {
        var thread = new Thread(runnable, "folder-watcher");
        thread.setDaemon(true);
        return thread;
    }

    // ==================== Poll Loop ====================

    private void watchLoop() {
        CountDownLatch signal = stopSignal;
        while (running.get()) {
            runCycle();
            if (!awaitNextCycle(signal)) {
                return;
            }
        }
    }

    private boolean awaitNextCycle(CountDownLatch signal) {
        try {
            return !signal.await(config.getPollIntervalSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Folder watcher interrupted while waiting for next cycle");
            return false;
        }
    }

    /**
     * Runs one poll cycle: extracts the current batch and dispatches each item
     * in extraction order. Never throws.
     *
     * @return summary of the cycle
     */
    public CycleResult runCycle() {
        var sample = Timer.start(metricsConfig.getRegistry());
        CycleResult result = processBatch();
        sample.stop(metricsConfig.getCycleTimer());
        metricsConfig.getCyclesCompleted().increment();
        cyclesCompleted.incrementAndGet();
        lastCycle = result;
        return result;
    }

    private CycleResult processBatch() {
        Instant startedAt = Instant.now();

        List<UrlItem> batch;
        try {
            batch = extractor.extract();
        } catch (Exception e) {
            log.warn("Folder scan failed, treating cycle as empty: {}", e.getMessage(), e);
            metricsConfig.getCyclesFailed().increment();
            return CycleResult.scanFailure(startedAt);
        }

        Map<DispatchOutcome, Integer> outcomes = new EnumMap<>(DispatchOutcome.class);
        for (UrlItem item : batch) {
            dispatchSafely(item).ifPresent(outcome -> outcomes.merge(outcome, 1, Integer::sum));
        }
        if (!batch.isEmpty()) {
            log.debug("Cycle processed {} URLs: {}", batch.size(), outcomes);
        }
        return new CycleResult(startedAt, batch.size(), outcomes, false);
    }

    private Optional<DispatchOutcome> dispatchSafely(UrlItem item) {
        try {
            return Optional.of(dispatcher.dispatch(item));
        } catch (Exception e) {
            log.error("Unexpected error processing URL {}", item.rawUrl(), e);
            return Optional.empty();
        }
    }

    // ==================== Monitoring ====================

    public boolean isRunning() {
        return running.get();
    }

    public long getCyclesCompleted() {
        return cyclesCompleted.get();
    }

    public Optional<CycleResult> getLastCycle() {
        return Optional.ofNullable(lastCycle);
    }

    private void logStartup() {
        log.info("Starting folder watcher on: {}", config.getFolderPath());
        log.info("Check interval: {} seconds", config.getPollIntervalSeconds());
        log.info("FFNet processing: {}", config.isFfnetDisable() ? "disabled" : "enabled");
    }
}

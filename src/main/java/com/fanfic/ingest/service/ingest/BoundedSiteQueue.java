package com.fanfic.ingest.service.ingest;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of SiteQueue using a bounded BlockingQueue.
 *
 * A full queue makes the producer wait up to the enqueue timeout and then
 * reports the rejection instead of dropping silently.
 */
@Slf4j
public class BoundedSiteQueue implements SiteQueue {

    private final String site;
    private final int capacity;
    private final BlockingQueue<UrlItem> queue;

    public BoundedSiteQueue(String site, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.site = site;
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public String getSite() {
        return site;
    }

    @Override
    public boolean enqueue(UrlItem item, long timeoutMs) {
        try {
            boolean offered = queue.offer(item, timeoutMs, TimeUnit.MILLISECONDS);
            if (!offered) {
                log.warn("Queue {} full, rejecting URL: {}", site, item.normalizedUrl());
            } else {
                log.debug("Enqueued URL on {}: {}", site, item.normalizedUrl());
            }
            return offered;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while enqueuing URL on {}: {}", site, item.normalizedUrl(), e);
            return false;
        }
    }

    @Override
    public Optional<UrlItem> dequeue(long timeoutMs) {
        try {
            UrlItem item = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (item != null) {
                log.debug("Dequeued URL from {}: {}", site, item.normalizedUrl());
            }
            return Optional.ofNullable(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while dequeuing from {}", site);
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }
}

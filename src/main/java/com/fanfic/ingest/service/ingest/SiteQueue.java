package com.fanfic.ingest.service.ingest;

import java.util.Optional;

/**
 * A queue of classified URLs for one site.
 *
 * The watcher is the producer; downstream site workers consume concurrently,
 * so implementations must be safe for concurrent use.
 */
public interface SiteQueue {

    /**
     * Gets the site identifier this queue serves.
     *
     * @return the site identifier
     */
    String getSite();

    /**
     * Attempts to enqueue an item with timeout.
     *
     * @param item the classified item to enqueue
     * @param timeoutMs timeout in milliseconds
     * @return true if successfully enqueued, false if timeout/full
     */
    boolean enqueue(UrlItem item, long timeoutMs);

    /**
     * Attempts to dequeue an item with timeout.
     *
     * @param timeoutMs timeout in milliseconds
     * @return the item if available, empty otherwise
     */
    Optional<UrlItem> dequeue(long timeoutMs);

    /**
     * Gets the current queue size.
     *
     * @return number of items in the queue
     */
    int size();

    /**
     * Gets the queue capacity.
     *
     * @return maximum capacity
     */
    int getCapacity();

    /**
     * Gets the queue utilization as a percentage.
     *
     * @return utilization percentage (0-100)
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }

    /**
     * Checks if the queue is at capacity.
     *
     * @return true if full
     */
    default boolean isFull() {
        return size() >= getCapacity();
    }
}

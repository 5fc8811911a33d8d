package com.fanfic.ingest.service.ingest;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only mapping from site identifier to the queue that receives its URLs.
 *
 * Sites without a dedicated queue fall back to the {@value #FALLBACK_SITE} queue,
 * when one is registered.
 */
public class DestinationRegistry {

    public static final String FALLBACK_SITE = "other";

    private final Map<String, SiteQueue> destinations;

    public DestinationRegistry(Map<String, ? extends SiteQueue> destinations) {
        this.destinations = Collections.unmodifiableMap(new LinkedHashMap<>(destinations));
    }

    /**
     * Finds the queue for a site: the exact match first, then the fallback queue.
     *
     * @param site the classified site identifier
     * @return the destination queue, empty if neither exists
     */
    public Optional<SiteQueue> resolve(String site) {
        SiteQueue queue = site != null ? destinations.get(site) : null;
        if (queue == null) {
            queue = destinations.get(FALLBACK_SITE);
        }
        return Optional.ofNullable(queue);
    }

    /**
     * Gets the queue registered under exactly this key, without fallback.
     */
    public Optional<SiteQueue> get(String site) {
        return Optional.ofNullable(destinations.get(site));
    }

    public Collection<SiteQueue> all() {
        return destinations.values();
    }

    public Map<String, SiteQueue> asMap() {
        return destinations;
    }
}

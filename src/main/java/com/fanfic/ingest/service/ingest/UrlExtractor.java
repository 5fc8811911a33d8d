package com.fanfic.ingest.service.ingest;

import java.util.List;

/**
 * Source of URLs for one poll cycle.
 */
public interface UrlExtractor {

    /**
     * Extracts every URL currently available. Consumed sources are removed
     * so the same URL is not returned by a later call.
     *
     * @return unclassified items, in no particular order
     * @throws IngestionException if the source itself cannot be scanned
     */
    List<UrlItem> extract();
}

package com.fanfic.ingest.service.classify;

import com.fanfic.ingest.service.ingest.IngestionException;

/**
 * Identifies which fanfiction site a URL belongs to.
 */
public interface UrlClassifier {

    /**
     * Classifies a raw URL.
     *
     * @param rawUrl the URL as read from the drop folder
     * @param verbose whether to log the match decision for this call
     * @return the site and normalized URL
     * @throws IngestionException with code {@code UNPARSEABLE_URL} if the input is not a usable URL
     */
    SiteClassification classify(String rawUrl, boolean verbose);
}

package com.fanfic.ingest.service.classify;

/**
 * Result of classifying one URL.
 *
 * @param site site identifier, {@code "other"} for unrecognised sites
 * @param normalizedUrl canonical form of the story URL
 */
public record SiteClassification(String site, String normalizedUrl) {
}

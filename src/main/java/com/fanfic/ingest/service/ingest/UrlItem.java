package com.fanfic.ingest.service.ingest;

import java.time.Instant;
import java.util.Objects;

/**
 * A URL extracted from one drop-folder file.
 *
 * Created unclassified by the extractor; {@link #classified(String, String)}
 * attaches the site and normalized URL and drops the source file reference,
 * which is only kept for diagnostics during extraction.
 */
public record UrlItem(
        String rawUrl,
        String site,
        String normalizedUrl,
        String sourceFile,
        Instant createdAt
) {

    public UrlItem {
        Objects.requireNonNull(rawUrl, "rawUrl is required");
        if (rawUrl.isBlank()) {
            throw new IllegalArgumentException("rawUrl must not be blank");
        }
    }

    public UrlItem(String rawUrl, String sourceFile) {
        this(rawUrl, null, null, sourceFile, Instant.now());
    }

    public UrlItem classified(String site, String normalizedUrl) {
        return new UrlItem(rawUrl, site, normalizedUrl, null, createdAt);
    }

    public boolean isClassified() {
        return site != null;
    }
}

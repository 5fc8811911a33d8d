package com.fanfic.ingest.service.classify;

import com.fanfic.ingest.service.ingest.DestinationRegistry;
import com.fanfic.ingest.service.ingest.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Default implementation of UrlClassifier.
 *
 * Recognises the sites listed in {@link FanficSite} by host and rewrites story
 * URLs to their canonical form. Any other well-formed http(s) URL is
 * classified as {@value DestinationRegistry#FALLBACK_SITE} and passed through unchanged.
 */
@Slf4j
@Component
public class RegexUrlClassifier implements UrlClassifier {

    private static final Pattern SCHEME_PREFIX = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://");
    private static final Pattern HOST = Pattern.compile("[A-Za-z0-9.-]+");

    @Override
    public SiteClassification classify(String rawUrl, boolean verbose) {
        UriComponents uri = parse(rawUrl);
        String trimmed = rawUrl.trim();

        Optional<FanficSite> site = FanficSite.forHost(uri.getHost());
        if (site.isEmpty()) {
            if (verbose) {
                log.debug("No known site for host {}, classifying as {}", uri.getHost(), DestinationRegistry.FALLBACK_SITE);
            }
            return new SiteClassification(DestinationRegistry.FALLBACK_SITE, trimmed);
        }

        FanficSite fanficSite = site.get();
        String normalized = fanficSite.canonicalUrl(uri.getPath()).orElse(trimmed);
        if (verbose) {
            log.debug("Classified {} as {} -> {}", trimmed, fanficSite.getId(), normalized);
        }
        return new SiteClassification(fanficSite.getId(), normalized);
    }

    /**
     * Only the scheme and host must be well formed; path and query are taken
     * as they are, so characters a browser tolerates do not reject the URL.
     */
    private UriComponents parse(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw unparseable(rawUrl, "URL is blank", null);
        }
        String candidate = rawUrl.trim();
        if (!SCHEME_PREFIX.matcher(candidate).find()) {
            candidate = "https://" + candidate;
        }

        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(candidate).build();
        } catch (IllegalArgumentException e) {
            throw unparseable(rawUrl, e.getMessage(), e);
        }

        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw unparseable(rawUrl, "unsupported scheme " + scheme, null);
        }
        String host = uri.getHost();
        if (host == null || !HOST.matcher(host).matches()) {
            throw unparseable(rawUrl, "URL has no valid host", null);
        }
        return uri;
    }

    private IngestionException unparseable(String rawUrl, String reason, Throwable cause) {
        String message = "Cannot parse URL '" + rawUrl + "': " + reason;
        return cause == null
                ? new IngestionException(message, rawUrl, IngestionException.UNPARSEABLE_URL)
                : new IngestionException(message, rawUrl, IngestionException.UNPARSEABLE_URL, cause);
    }
}

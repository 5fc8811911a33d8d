package com.fanfic.ingest.service.classify;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fanfiction sites with a dedicated URL format.
 *
 * A site is recognised by host; the story pattern extracts the story id
 * used to build the canonical URL.
 */
public enum FanficSite {

    ARCHIVE_OF_OUR_OWN("archiveofourown.org",
            Set.of("archiveofourown.org", "www.archiveofourown.org", "ao3.org", "www.ao3.org"),
            "^/(?:collections/[^/]+/)?works/(\\d+)",
            "https://archiveofourown.org/works/%s"),

    FANFICTION_NET("fanfiction.net",
            Set.of("fanfiction.net", "www.fanfiction.net", "m.fanfiction.net"),
            "^/s/(\\d+)",
            "https://www.fanfiction.net/s/%s/1/"),

    FICTIONPRESS("fictionpress.com",
            Set.of("fictionpress.com", "www.fictionpress.com", "m.fictionpress.com"),
            "^/s/(\\d+)",
            "https://www.fictionpress.com/s/%s/1/"),

    SPACEBATTLES("spacebattles.com",
            Set.of("forums.spacebattles.com", "spacebattles.com", "www.spacebattles.com"),
            "^/threads/([^/]+\\.\\d+)",
            "https://forums.spacebattles.com/threads/%s/"),

    SUFFICIENT_VELOCITY("sufficientvelocity.com",
            Set.of("forums.sufficientvelocity.com", "sufficientvelocity.com"),
            "^/threads/([^/]+\\.\\d+)",
            "https://forums.sufficientvelocity.com/threads/%s/"),

    QUESTIONABLE_QUESTING("questionablequesting.com",
            Set.of("forum.questionablequesting.com", "questionablequesting.com"),
            "^/threads/([^/]+\\.\\d+)",
            "https://forum.questionablequesting.com/threads/%s/"),

    ROYAL_ROAD("royalroad.com",
            Set.of("royalroad.com", "www.royalroad.com"),
            "^/fiction/(\\d+)",
            "https://www.royalroad.com/fiction/%s");

    private final String id;
    private final Set<String> hosts;
    private final Pattern storyPath;
    private final String canonicalFormat;

    FanficSite(String id, Set<String> hosts, String storyPath, String canonicalFormat) {
        this.id = id;
        this.hosts = hosts;
        this.storyPath = Pattern.compile(storyPath);
        this.canonicalFormat = canonicalFormat;
    }

    public String getId() {
        return id;
    }

    /**
     * Finds the site served from the given host.
     */
    public static Optional<FanficSite> forHost(String host) {
        String normalizedHost = host.toLowerCase(Locale.ROOT);
        for (FanficSite site : values()) {
            if (site.hosts.contains(normalizedHost)) {
                return Optional.of(site);
            }
        }
        return Optional.empty();
    }

    /**
     * Builds the canonical story URL from a path on this site.
     *
     * @return the canonical URL, empty if the path is not a story path
     */
    public Optional<String> canonicalUrl(String path) {
        Matcher matcher = storyPath.matcher(path == null ? "" : path);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(String.format(canonicalFormat, matcher.group(1)));
    }
}

package com.fanfic.ingest.service.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the drop-folder watcher.
 *
 * Bound once at startup; a missing folder path or a non-positive poll
 * interval fails the application context before the loop can start.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fanfic.folder-watcher")
public class FolderWatcherConfig {

    /**
     * Folder scanned for *.url files. Created (with parents) if missing.
     */
    @NotBlank(message = "folderPath must be specified in configuration")
    private String folderPath;

    /**
     * Seconds to wait between two poll cycles.
     */
    @Positive(message = "pollIntervalSeconds must be positive")
    private int pollIntervalSeconds = 60;

    /**
     * Divert fanfiction.net URLs to the notifier instead of queueing them.
     */
    private boolean ffnetDisable = false;

    /**
     * Start the poll loop when the application starts.
     */
    private boolean enabled = true;

    /**
     * Log the classifier's match decisions at debug level.
     */
    private boolean classifierVerbose = false;
}

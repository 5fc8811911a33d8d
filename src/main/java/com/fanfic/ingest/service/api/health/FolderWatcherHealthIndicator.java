package com.fanfic.ingest.service.api.health;

import com.fanfic.ingest.service.ingest.FolderUrlExtractor;
import com.fanfic.ingest.service.ingest.FolderWatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for the drop folder.
 *
 * DOWN when the watched folder is missing or not readable; stuck files are
 * the operator's signal for anything finer.
 */
@Component
@RequiredArgsConstructor
public class FolderWatcherHealthIndicator implements HealthIndicator {

    private final FolderUrlExtractor extractor;
    private final FolderWatcher watcher;

    @Override
    public Health health() {
        Path folder = extractor.getFolder();
        boolean accessible = Files.isDirectory(folder) && Files.isReadable(folder) && Files.isWritable(folder);

        Health.Builder builder = accessible ? Health.up() : Health.down();
        builder.withDetail("folder", folder.toAbsolutePath().toString())
                .withDetail("running", watcher.isRunning())
                .withDetail("cyclesCompleted", watcher.getCyclesCompleted());
        watcher.getLastCycle().ifPresent(cycle -> builder
                .withDetail("lastCycleAt", cycle.startedAt().toString())
                .withDetail("lastCycleScanFailed", cycle.scanFailed()));
        return builder.build();
    }
}

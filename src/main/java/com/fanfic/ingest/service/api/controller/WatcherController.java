package com.fanfic.ingest.service.api.controller;

import com.fanfic.ingest.service.api.dto.ApiResponse;
import com.fanfic.ingest.service.api.dto.WatcherStatusResponse;
import com.fanfic.ingest.service.config.FolderWatcherConfig;
import com.fanfic.ingest.service.ingest.CycleResult;
import com.fanfic.ingest.service.ingest.FolderWatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller exposing the folder watcher's state.
 */
@RestController
@RequestMapping("/watcher")
@Tag(name = "Folder Watcher", description = "Status of the drop-folder poll loop")
@RequiredArgsConstructor
public class WatcherController {

    private final FolderWatcher folderWatcher;
    private final FolderWatcherConfig config;

    @GetMapping
    @Operation(summary = "Get watcher status", description = "Returns the watched folder, poll settings and the last cycle summary.")
    public ResponseEntity<ApiResponse<WatcherStatusResponse>> getStatus() {
        WatcherStatusResponse response = WatcherStatusResponse.builder()
                .folderPath(config.getFolderPath())
                .pollIntervalSeconds(config.getPollIntervalSeconds())
                .ffnetDisable(config.isFfnetDisable())
                .running(folderWatcher.isRunning())
                .cyclesCompleted(folderWatcher.getCyclesCompleted())
                .lastCycle(folderWatcher.getLastCycle().map(this::toLastCycle).orElse(null))
                .build();
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    private WatcherStatusResponse.LastCycle toLastCycle(CycleResult cycle) {
        Map<String, Integer> outcomes = new LinkedHashMap<>();
        cycle.outcomes().forEach((outcome, count) -> outcomes.put(outcome.name(), count));

        return WatcherStatusResponse.LastCycle.builder()
                .startedAt(cycle.startedAt())
                .extracted(cycle.extracted())
                .delivered(cycle.delivered())
                .dropped(cycle.dropped())
                .scanFailed(cycle.scanFailed())
                .outcomes(outcomes)
                .build();
    }
}

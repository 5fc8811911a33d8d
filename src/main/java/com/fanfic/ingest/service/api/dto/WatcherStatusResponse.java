package com.fanfic.ingest.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * State of the folder watcher and its most recent poll cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WatcherStatusResponse {

    private String folderPath;
    private int pollIntervalSeconds;
    private boolean ffnetDisable;
    private boolean running;
    private long cyclesCompleted;

    /**
     * Summary of the last cycle (null before the first cycle).
     */
    private LastCycle lastCycle;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LastCycle {
        private Instant startedAt;
        private int extracted;
        private int delivered;
        private int dropped;
        private boolean scanFailed;
        private Map<String, Integer> outcomes;
    }
}

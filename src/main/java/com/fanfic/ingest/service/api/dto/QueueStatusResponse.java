package com.fanfic.ingest.service.api.dto;

import com.fanfic.ingest.service.ingest.SiteQueue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Depth and capacity of one site queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusResponse {

    private String site;
    private int size;
    private int capacity;
    private int utilizationPercent;

    public static QueueStatusResponse from(SiteQueue queue) {
        return QueueStatusResponse.builder()
                .site(queue.getSite())
                .size(queue.size())
                .capacity(queue.getCapacity())
                .utilizationPercent(queue.getUtilizationPercent())
                .build();
    }
}

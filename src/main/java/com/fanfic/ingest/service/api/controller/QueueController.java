package com.fanfic.ingest.service.api.controller;

import com.fanfic.ingest.service.api.dto.ApiResponse;
import com.fanfic.ingest.service.api.dto.QueueStatusResponse;
import com.fanfic.ingest.service.ingest.DestinationRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Controller for inspecting the per-site queues.
 *
 * Read-only: URLs enter the queues through the drop folder only.
 */
@RestController
@RequestMapping("/queues")
@Tag(name = "Site Queues", description = "Depth of the per-site URL queues")
@RequiredArgsConstructor
public class QueueController {

    private final DestinationRegistry destinations;

    @GetMapping
    @Operation(summary = "List queues", description = "Returns size and capacity of every site queue, including the fallback queue.")
    public ResponseEntity<ApiResponse<List<QueueStatusResponse>>> listQueues() {
        List<QueueStatusResponse> queues = destinations.all().stream()
                .map(QueueStatusResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success(queues));
    }

    @GetMapping("/{site}")
    @Operation(summary = "Get queue", description = "Returns the queue registered for exactly this site.")
    public ResponseEntity<ApiResponse<QueueStatusResponse>> getQueue(
            @Parameter(description = "Site identifier, e.g. archiveofourown.org") @PathVariable String site) {
        return destinations.get(site)
                .map(queue -> ResponseEntity.ok(ApiResponse.success(QueueStatusResponse.from(queue))))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.<QueueStatusResponse>error("No queue for site: " + site, "NOT_FOUND")));
    }
}

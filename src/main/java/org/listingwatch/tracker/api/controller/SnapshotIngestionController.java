package org.listingwatch.tracker.api.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.api.dto.ApiResponse;
import org.listingwatch.tracker.api.dto.IngestResult;
import org.listingwatch.tracker.api.dto.SnapshotIngestionRequest;
import org.listingwatch.tracker.service.SnapshotIngestionService;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * POST /v1/snapshots: scrapers submit one raw listing payload.
 */
@RestController
@RequestMapping("/v1/snapshots")
@RequiredArgsConstructor
@Slf4j
public class SnapshotIngestionController {

    private final SnapshotIngestionService ingestionService;

    @PostMapping
    public ResponseEntity<ApiResponse<IngestResult>> ingestSnapshot(
            @Valid @RequestBody SnapshotIngestionRequest request,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId) {

        MDC.put("correlationId", correlationId != null ? correlationId : UUID.randomUUID().toString());
        MDC.put("source", request.getSource());

        try {
            log.info("Received snapshot: source={}, observedAt={}", request.getSource(), request.getObservedAt());

            IngestResult result = ingestionService.ingest(request);
            HttpStatus status = result.isUnchanged() ? HttpStatus.OK : HttpStatus.ACCEPTED;

            return ResponseEntity.status(status)
                    .body(ApiResponse.success(result));
        } finally {
            MDC.clear();
        }
    }
}

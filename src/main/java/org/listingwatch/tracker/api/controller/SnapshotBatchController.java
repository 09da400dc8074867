package org.listingwatch.tracker.api.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.api.dto.ApiResponse;
import org.listingwatch.tracker.api.dto.BatchIngestionResponse;
import org.listingwatch.tracker.api.dto.BatchSnapshotRequest;
import org.listingwatch.tracker.service.SnapshotIngestionService;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * POST /v1/snapshots/batch: a scraper run submits many payloads at once.
 */
@RestController
@RequestMapping("/v1/snapshots/batch")
@RequiredArgsConstructor
@Slf4j
public class SnapshotBatchController {

    private final SnapshotIngestionService ingestionService;

    @PostMapping
    public ResponseEntity<ApiResponse<BatchIngestionResponse>> ingestBatch(
            @Valid @RequestBody BatchSnapshotRequest request,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId) {

        MDC.put("correlationId", correlationId != null ? correlationId : UUID.randomUUID().toString());
        try {
            log.info("Received batch of {} snapshots", request.getSnapshots().size());

            BatchIngestionResponse response = ingestionService.ingestBatch(request.getSnapshots());

            log.info("Batch processed: total={}, accepted={}, unchanged={}, rejected={}",
                    response.getTotal(), response.getAccepted(), response.getUnchanged(), response.getRejected());

            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(ApiResponse.success(response));
        } finally {
            MDC.clear();
        }
    }
}

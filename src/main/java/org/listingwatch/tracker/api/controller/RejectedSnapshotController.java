package org.listingwatch.tracker.api.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.api.dto.ApiResponse;
import org.listingwatch.tracker.api.dto.RejectedSnapshotDto;
import org.listingwatch.tracker.domain.model.RejectedSnapshot;
import org.listingwatch.tracker.domain.model.enums.RejectionReason;
import org.listingwatch.tracker.service.RejectedSnapshotService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.UUID;

/**
 * View and resolve snapshots that were rejected during ingestion.
 */
@RestController
@RequestMapping("/v1/rejected-snapshots")
@RequiredArgsConstructor
@Slf4j
public class RejectedSnapshotController {

    private final RejectedSnapshotService rejectedSnapshotService;

    @GetMapping
    public ResponseEntity<ApiResponse<Page<RejectedSnapshotDto>>> listRejected(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(required = false) String reason,
            @RequestParam(required = false) String source) {

        PageRequest pageRequest = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "receivedAt"));

        Page<RejectedSnapshot> rejected;
        if (reason != null && !reason.isBlank()) {
            rejected = rejectedSnapshotService.findByReason(
                    RejectionReason.valueOf(reason.trim().toUpperCase(Locale.ROOT)), pageRequest);
        } else if (source != null && !source.isBlank()) {
            rejected = rejectedSnapshotService.findBySource(source.trim().toLowerCase(Locale.ROOT), pageRequest);
        } else {
            rejected = rejectedSnapshotService.listUnresolved(pageRequest);
        }

        return ResponseEntity.ok(ApiResponse.success(rejected.map(RejectedSnapshotDto::from)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<RejectedSnapshotDto>> getRejected(@PathVariable UUID id) {
        return rejectedSnapshotService.findById(id)
                .map(rejected -> ResponseEntity.ok(ApiResponse.success(RejectedSnapshotDto.from(rejected))))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<ApiResponse<RejectedSnapshotDto>> resolveRejected(@PathVariable UUID id) {
        return rejectedSnapshotService.resolve(id)
                .map(rejected -> {
                    log.info("Rejected snapshot {} marked as resolved", id);
                    return ResponseEntity.ok(ApiResponse.success(RejectedSnapshotDto.from(rejected)));
                })
                .orElse(ResponseEntity.notFound().build());
    }
}

package org.listingwatch.tracker.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.domain.model.RejectedSnapshot;
import org.listingwatch.tracker.domain.model.enums.FailureStage;
import org.listingwatch.tracker.domain.model.enums.RejectionReason;
import org.listingwatch.tracker.domain.repository.RejectedSnapshotRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists and queries snapshots that could not be applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RejectedSnapshotService {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RejectedSnapshotRepository rejectedSnapshotRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public RejectedSnapshot persistRejection(
            String source,
            String listingId,
            JsonNode rawPayload,
            RejectionReason reason,
            FailureStage stage,
            String errorDetails,
            String correlationId) {

        RejectedSnapshot rejected = RejectedSnapshot.builder()
                .source(source != null ? source : "unknown")
                .listingId(listingId)
                .rawPayload(toMap(rawPayload))
                .rejectionReason(reason)
                .failureStage(stage)
                .errorDetails(errorDetails)
                .correlationId(correlationId)
                .receivedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();

        RejectedSnapshot saved = rejectedSnapshotRepository.save(rejected);
        log.error("Rejected snapshot: source={}, listing={}, reason={}, stage={}",
                source, listingId, reason, stage);
        return saved;
    }

    public Page<RejectedSnapshot> listUnresolved(Pageable pageable) {
        return rejectedSnapshotRepository.findByResolvedFalse(pageable);
    }

    public Optional<RejectedSnapshot> findById(UUID id) {
        return rejectedSnapshotRepository.findById(id);
    }

    public Page<RejectedSnapshot> findByReason(RejectionReason reason, Pageable pageable) {
        return rejectedSnapshotRepository.findByRejectionReason(reason, pageable);
    }

    public Page<RejectedSnapshot> findBySource(String source, Pageable pageable) {
        return rejectedSnapshotRepository.findBySource(source, pageable);
    }

    /**
     * Mark a rejected snapshot as handled, e.g. after the scraper was fixed and it was resubmitted.
     */
    @Transactional
    public Optional<RejectedSnapshot> resolve(UUID id) {
        return rejectedSnapshotRepository.findById(id).map(rejected -> {
            rejected.setResolved(true);
            rejected.setResolvedAt(OffsetDateTime.now(ZoneOffset.UTC));
            return rejectedSnapshotRepository.save(rejected);
        });
    }

    private Map<String, Object> toMap(JsonNode rawPayload) {
        if (rawPayload == null || rawPayload.isNull() || rawPayload.isMissingNode()) {
            return null;
        }
        if (rawPayload.isObject()) {
            return objectMapper.convertValue(rawPayload, MAP_TYPE);
        }
        return Map.of("payload", objectMapper.convertValue(rawPayload, Object.class));
    }
}

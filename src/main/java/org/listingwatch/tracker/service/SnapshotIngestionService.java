package org.listingwatch.tracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.api.dto.BatchIngestionResponse;
import org.listingwatch.tracker.api.dto.IngestResult;
import org.listingwatch.tracker.api.dto.ListingEventMessage;
import org.listingwatch.tracker.api.dto.SnapshotIngestionRequest;
import org.listingwatch.tracker.api.exception.ConflictException;
import org.listingwatch.tracker.api.exception.ErrorCode;
import org.listingwatch.tracker.api.exception.InvalidStateException;
import org.listingwatch.tracker.api.exception.NormalizationException;
import org.listingwatch.tracker.api.exception.UnknownSourceException;
import org.listingwatch.tracker.config.IngestionExecutorConfig;
import org.listingwatch.tracker.domain.model.Listing;
import org.listingwatch.tracker.domain.model.ListingEvent;
import org.listingwatch.tracker.domain.model.enums.FailureStage;
import org.listingwatch.tracker.domain.model.enums.RejectionReason;
import org.listingwatch.tracker.normalizer.CanonicalSnapshot;
import org.listingwatch.tracker.normalizer.NormalizerRegistry;
import org.listingwatch.tracker.store.ListingStore;
import org.listingwatch.tracker.timeline.InMemoryEventTimeline;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Main orchestrator: normalize → fingerprint → lock → merge into the aggregate → commit → publish.
 * <p>
 * Nothing is written for a snapshot until the listing, its new events and its fingerprint are
 * committed together, so a failed ingestion leaves the stored listing as it was.
 */
@Service
@Slf4j
public class SnapshotIngestionService {

    private final NormalizerRegistry normalizerRegistry;
    private final SnapshotFingerprinter fingerprinter;
    private final DeduplicationService deduplicationService;
    private final ListingLockManager lockManager;
    private final ListingStore listingStore;
    private final ListingEventPublisher eventPublisher;
    private final RejectedSnapshotService rejectedSnapshotService;
    private final Executor ingestionExecutor;
    private final int conflictMaxRetries;

    // Metrics
    private final Timer ingestionTimer;
    private final MeterRegistry meterRegistry;

    public SnapshotIngestionService(
            NormalizerRegistry normalizerRegistry,
            SnapshotFingerprinter fingerprinter,
            DeduplicationService deduplicationService,
            ListingLockManager lockManager,
            ListingStore listingStore,
            ListingEventPublisher eventPublisher,
            RejectedSnapshotService rejectedSnapshotService,
            @Qualifier(IngestionExecutorConfig.INGESTION_EXECUTOR) Executor ingestionExecutor,
            @Value("${listings.ingestion.conflict-max-retries:3}") int conflictMaxRetries,
            MeterRegistry meterRegistry) {
        this.normalizerRegistry = normalizerRegistry;
        this.fingerprinter = fingerprinter;
        this.deduplicationService = deduplicationService;
        this.lockManager = lockManager;
        this.listingStore = listingStore;
        this.eventPublisher = eventPublisher;
        this.rejectedSnapshotService = rejectedSnapshotService;
        this.ingestionExecutor = ingestionExecutor;
        this.conflictMaxRetries = conflictMaxRetries;
        this.meterRegistry = meterRegistry;
        this.ingestionTimer = Timer.builder("listings.ingestion.duration")
                .description("Snapshot ingestion latency, normalization to publish")
                .register(meterRegistry);
    }

    /**
     * Ingest one raw snapshot.
     *
     * @param observedAt when the snapshot was captured; null to use the payload's own timestamp
     *                   or, failing that, the receive time
     * @throws UnknownSourceException if no normalizer handles {@code sourceId}
     * @throws NormalizationException if the payload lacks the listing id or address identity
     * @throws InvalidStateException  if applying the snapshot would break a listing invariant
     * @throws ConflictException      if concurrent writers still won after the configured retries
     */
    public IngestResult ingest(String sourceId, JsonNode payload, OffsetDateTime observedAt) {
        String correlationId = MDC.get("correlationId");
        return ingestionTimer.record(() -> doIngest(sourceId, payload, observedAt, correlationId));
    }

    public IngestResult ingest(SnapshotIngestionRequest request) {
        return ingest(request.getSource(), request.getPayload(), request.getObservedAt());
    }

    /**
     * Ingest several snapshots. All are normalized first; snapshots of the same listing are then
     * applied in observation order (ties keep request order), and different listings in parallel.
     * Failures are reported per item instead of failing the batch.
     */
    public BatchIngestionResponse ingestBatch(List<SnapshotIngestionRequest> requests) {
        String correlationId = MDC.get("correlationId");
        OffsetDateTime receivedAt = OffsetDateTime.now(ZoneOffset.UTC);
        IngestResult[] results = new IngestResult[requests.size()];

        // Step 1: normalize everything and group by listing
        Map<String, List<PreparedSnapshot>> groups = new LinkedHashMap<>();
        for (int i = 0; i < requests.size(); i++) {
            SnapshotIngestionRequest request = requests.get(i);
            try {
                CanonicalSnapshot snapshot = normalize(request.getSource(), request.getPayload(), correlationId);
                OffsetDateTime observedAt = effectiveObservedAt(request.getObservedAt(), snapshot, receivedAt);
                groups.computeIfAbsent(snapshot.getListingId(), id -> new ArrayList<>())
                        .add(new PreparedSnapshot(i, request.getPayload(), snapshot, observedAt));
            } catch (UnknownSourceException e) {
                results[i] = IngestResult.rejected(null, RejectionReason.UNKNOWN_SOURCE.name(), e.getMessage(), receivedAt);
            } catch (NormalizationException e) {
                results[i] = IngestResult.rejected(null, RejectionReason.MISSING_IDENTITY.name(),
                        e.getField() + ": " + e.getMessage(), receivedAt);
            }
        }

        // Step 2: one sequential task per listing, run on the worker pool
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (List<PreparedSnapshot> group : groups.values()) {
            group.sort(Comparator.comparing(PreparedSnapshot::getObservedAt, OffsetDateTime.timeLineOrder()));
            tasks.add(CompletableFuture.runAsync(() -> {
                for (PreparedSnapshot prepared : group) {
                    results[prepared.getIndex()] = ingestionTimer.record(
                            () -> ingestPrepared(prepared, receivedAt, correlationId));
                }
            }, ingestionExecutor));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        return BatchIngestionResponse.of(Arrays.asList(results));
    }

    private IngestResult doIngest(String sourceId, JsonNode payload, OffsetDateTime observedAt, String correlationId) {
        OffsetDateTime receivedAt = OffsetDateTime.now(ZoneOffset.UTC);

        // Step 1: source-specific normalization
        CanonicalSnapshot snapshot = normalize(sourceId, payload, correlationId);

        // Steps 2-5: fingerprint, lock, merge, commit, publish
        return ingestNormalized(snapshot, payload, effectiveObservedAt(observedAt, snapshot, receivedAt),
                receivedAt, correlationId);
    }

    private CanonicalSnapshot normalize(String sourceId, JsonNode payload, String correlationId) {
        try {
            CanonicalSnapshot snapshot = normalizerRegistry.normalize(sourceId, payload);
            log.debug("Normalized {} snapshot for listing {}", snapshot.getSourceId(), snapshot.getListingId());
            return snapshot;
        } catch (UnknownSourceException e) {
            recordMetric("unknown", "rejected");
            deadLetter(sourceId, null, payload, RejectionReason.UNKNOWN_SOURCE,
                    FailureStage.NORMALIZATION, e.getMessage(), correlationId);
            throw e;
        } catch (NormalizationException e) {
            recordMetric(e.getSource(), "rejected");
            deadLetter(sourceId, null, payload, RejectionReason.MISSING_IDENTITY,
                    FailureStage.NORMALIZATION, e.getField() + ": " + e.getMessage(), correlationId);
            throw e;
        }
    }

    private IngestResult ingestNormalized(CanonicalSnapshot snapshot, JsonNode payload, OffsetDateTime observedAt,
                                          OffsetDateTime receivedAt, String correlationId) {
        String listingId = snapshot.getListingId();

        // Step 2: content fingerprint
        String fingerprint = fingerprinter.fingerprint(snapshot);

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                // Steps 3-5 run under the listing's lock
                IngestResult result = lockManager.withLock(listingId,
                        () -> applyLocked(snapshot, fingerprint, observedAt, receivedAt));
                recordMetric(snapshot.getSourceId(), result.isUnchanged() ? "unchanged" : "accepted");
                log.info("Ingested {} snapshot: listing={}, status={}, events={}", snapshot.getSourceId(),
                        listingId, result.getStatus(), result.getEvents().size());
                return result;
            } catch (ConflictException e) {
                if (attempt > conflictMaxRetries) {
                    recordMetric(snapshot.getSourceId(), "rejected");
                    deadLetter(snapshot.getSourceId(), listingId, payload, RejectionReason.CONFLICT,
                            FailureStage.PERSISTENCE, e.getMessage(), correlationId);
                    throw e;
                }
                log.warn("Conflict on listing {} (attempt {} of {}), retrying: {}",
                        listingId, attempt, conflictMaxRetries + 1, e.getMessage());
            } catch (InvalidStateException e) {
                recordMetric(snapshot.getSourceId(), "rejected");
                deadLetter(snapshot.getSourceId(), listingId, payload, RejectionReason.INVALID_STATE,
                        FailureStage.AGGREGATE, e.getMessage(), correlationId);
                throw e;
            }
        }
    }

    private IngestResult applyLocked(CanonicalSnapshot snapshot, String fingerprint,
                                     OffsetDateTime observedAt, OffsetDateTime receivedAt) {
        String listingId = snapshot.getListingId();

        // Step 3: idempotency guard
        if (deduplicationService.isUnchanged(listingId, fingerprint)) {
            log.debug("Snapshot for listing {} unchanged since last ingestion", listingId);
            return IngestResult.unchanged(listingId, receivedAt);
        }

        // Step 4: merge into the aggregate, staging derived events
        Listing listing = listingStore.findListing(listingId)
                .orElseGet(() -> Listing.create(listingId, observedAt));
        InMemoryEventTimeline staged = new InMemoryEventTimeline();
        listing.applyDescriptive(snapshot);
        listing.applyPrice(snapshot.getPrice(), observedAt, staged);
        listing.applyAuction(snapshot.getStatus(), snapshot.getAuctionDatetime(), observedAt,
                snapshot.getAuctionNotes(), staged);
        listing.markUpdated(receivedAt);
        List<ListingEvent> events = staged.recorded();

        // Step 5: atomic commit, then cache and publish
        listingStore.commit(listing, events, fingerprint);
        deduplicationService.markProcessed(listingId, fingerprint);
        eventPublisher.publishAll(events);

        return IngestResult.accepted(listingId, events.stream().map(ListingEventMessage::from).toList(), receivedAt);
    }

    private IngestResult ingestPrepared(PreparedSnapshot prepared, OffsetDateTime receivedAt, String correlationId) {
        String listingId = prepared.getSnapshot().getListingId();
        try {
            return ingestNormalized(prepared.getSnapshot(), prepared.getPayload(), prepared.getObservedAt(),
                    receivedAt, correlationId);
        } catch (ConflictException e) {
            return IngestResult.rejected(listingId, RejectionReason.CONFLICT.name(), e.getMessage(), receivedAt);
        } catch (InvalidStateException e) {
            return IngestResult.rejected(listingId, RejectionReason.INVALID_STATE.name(), e.getMessage(), receivedAt);
        } catch (RuntimeException e) {
            log.error("Unexpected failure ingesting listing {} in batch", listingId, e);
            return IngestResult.rejected(listingId, ErrorCode.INTERNAL_ERROR.name(), e.getMessage(), receivedAt);
        }
    }

    private static OffsetDateTime effectiveObservedAt(OffsetDateTime requested, CanonicalSnapshot snapshot,
                                                      OffsetDateTime receivedAt) {
        if (requested != null) {
            return requested;
        }
        return snapshot.getObservedAt() != null ? snapshot.getObservedAt() : receivedAt;
    }

    // dead-lettering is best effort; the caller still sees the original failure
    private void deadLetter(String source, String listingId, JsonNode payload, RejectionReason reason,
                            FailureStage stage, String details, String correlationId) {
        try {
            rejectedSnapshotService.persistRejection(source, listingId, payload, reason, stage, details, correlationId);
        } catch (DataAccessException e) {
            log.error("Failed to dead-letter snapshot from {} (listing {}): {}", source, listingId, e.getMessage());
        }
    }

    private void recordMetric(String source, String outcome) {
        Counter.builder("listings.snapshots.received")
                .tag("source", source != null ? source : "unknown")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    @Getter
    @AllArgsConstructor
    private static class PreparedSnapshot {
        private final int index;
        private final JsonNode payload;
        private final CanonicalSnapshot snapshot;
        private final OffsetDateTime observedAt;
    }
}

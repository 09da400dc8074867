package org.listingwatch.tracker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.listingwatch.tracker.api.dto.BatchIngestionResponse;
import org.listingwatch.tracker.api.dto.IngestResult;
import org.listingwatch.tracker.api.dto.ListingEventMessage;
import org.listingwatch.tracker.api.dto.SnapshotIngestionRequest;
import org.listingwatch.tracker.api.exception.ConflictException;
import org.listingwatch.tracker.api.exception.NormalizationException;
import org.listingwatch.tracker.api.exception.UnknownSourceException;
import org.listingwatch.tracker.domain.model.Listing;
import org.listingwatch.tracker.domain.model.enums.EventType;
import org.listingwatch.tracker.domain.model.enums.FailureStage;
import org.listingwatch.tracker.domain.model.enums.IngestStatus;
import org.listingwatch.tracker.domain.model.enums.ListingStatus;
import org.listingwatch.tracker.domain.model.enums.RejectionReason;
import org.listingwatch.tracker.normalizer.DomainListingNormalizer;
import org.listingwatch.tracker.normalizer.NormalizerRegistry;
import org.listingwatch.tracker.normalizer.RealestateListingNormalizer;
import org.listingwatch.tracker.store.InMemoryListingStore;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Pipeline tests over an in-memory store; Redis is disabled, Kafka and the dead-letter
 * table are mocked.
 */
class SnapshotIngestionServiceTest {

    private static final ZoneId MELBOURNE = ZoneId.of("Australia/Melbourne");
    private static final OffsetDateTime T0 = OffsetDateTime.parse("2024-11-01T09:00:00+11:00");
    private static final OffsetDateTime T1 = T0.plusDays(7);
    private static final OffsetDateTime T2 = T0.plusDays(14);

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final ListingEventPublisher publisher = mock(ListingEventPublisher.class);
    private final RejectedSnapshotService rejectedSnapshotService = mock(RejectedSnapshotService.class);

    private InMemoryListingStore store;
    private SimpleMeterRegistry meterRegistry;
    private SnapshotIngestionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryListingStore();
        meterRegistry = new SimpleMeterRegistry();
        NormalizerRegistry registry = new NormalizerRegistry(List.of(
                new DomainListingNormalizer(MELBOURNE), new RealestateListingNormalizer(MELBOURNE)));
        DeduplicationService deduplicationService =
                new DeduplicationService(mock(StringRedisTemplate.class), store, false, 24);

        service = new SnapshotIngestionService(
                registry,
                new SnapshotFingerprinter(mapper),
                deduplicationService,
                new ListingLockManager(2_000),
                store,
                publisher,
                rejectedSnapshotService,
                executor,
                3,
                meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // --- Single snapshot ---

    @Test
    void shouldCreateListingOnFirstIngestion() {
        IngestResult result = service.ingest("domain", domainPayload("1001", 800000, "2024-12-20T10:00:00"), T0);

        assertEquals(IngestStatus.ACCEPTED, result.getStatus());
        assertEquals("domain:1001", result.getListingId());
        assertTrue(result.getEvents().isEmpty());

        Listing listing = store.findListing("domain:1001").orElseThrow();
        assertEquals(T0, listing.getCreatedAt());
        assertEquals("Richmond", listing.getSuburb());
        assertEquals(ListingStatus.SCHEDULED, listing.getStatus());
        assertEquals(1, listing.getPriceHistory().size());
        assertEquals(1, listing.getAuctionHistory().size());
        assertEquals("domain", listing.getSource());
    }

    @Test
    void shouldReportIdenticalPayloadAsUnchanged() {
        ObjectNode payload = domainPayload("1001", 800000, "2024-12-20T10:00:00");
        service.ingest("domain", payload, T0);

        IngestResult second = service.ingest("domain", payload.deepCopy(), T1);

        assertTrue(second.isUnchanged());
        assertTrue(second.getEvents().isEmpty());
        assertEquals(1, store.commitAttempts());
        Listing listing = store.findListing("domain:1001").orElseThrow();
        assertEquals(1, listing.getPriceHistory().size());
        assertEquals(1, listing.getAuctionHistory().size());
        verify(publisher, times(1)).publishAll(anyList());
    }

    @Test
    void shouldEmitPriceDropAndPublishIt() {
        service.ingest("domain", domainPayload("1001", 800000, null), T0);

        IngestResult result = service.ingest("domain", domainPayload("1001", 750000, null), T1);

        assertEquals(1, result.getEvents().size());
        ListingEventMessage event = result.getEvents().get(0);
        assertEquals("PRICE_DROPPED", event.getEventType());
        assertEquals(T1, event.getTimestamp());
        assertEquals(0, new BigDecimal("6.25").compareTo((BigDecimal) event.getMetadata().get("drop_percent")));
        assertEquals(1, store.events().size());
        assertNotNull(store.events().get(0).getRecordedAt());
        verify(publisher).publishAll(store.events());
    }

    @Test
    void shouldEmitSingleRescheduleEvent() {
        service.ingest("domain", domainPayload("1001", 800000, "2024-12-20T10:00:00"), T0);

        IngestResult result = service.ingest("domain", domainPayload("1001", 800000, "2024-12-27T10:00:00"), T1);

        assertEquals(1, result.getEvents().size());
        assertEquals("AUCTION_RESCHEDULED", result.getEvents().get(0).getEventType());
        assertEquals(OffsetDateTime.parse("2024-12-27T10:00:00+11:00"),
                store.findListing("domain:1001").orElseThrow().getAuctionDatetime());
    }

    @Test
    void shouldEmitCancellationOnce() {
        service.ingest("domain", domainPayload("1001", 800000, "2024-12-20T10:00:00"), T0);
        ObjectNode cancelled = domainPayload("1001", 800000, "2024-12-20T10:00:00");
        ((ObjectNode) cancelled.get("auctionSchedule")).put("status", "Cancelled");

        IngestResult first = service.ingest("domain", cancelled, T1);
        IngestResult repeat = service.ingest("domain", cancelled.deepCopy(), T2);

        assertEquals("AUCTION_CANCELLED", first.getEvents().get(0).getEventType());
        assertEquals("SCHEDULED", first.getEvents().get(0).getMetadata().get("previous_status"));
        assertTrue(repeat.isUnchanged());
        assertEquals(1, store.events().size());
    }

    @Test
    void shouldMergeTwoSourcesIntoOneListing() {
        service.ingest("domain", domainPayload("realestate:149785064", 800000, null), T0);

        IngestResult result = service.ingest("realestate", realestatePayload("149785064", "$750,000"), T1);

        assertEquals("realestate:149785064", result.getListingId());
        assertEquals(1, store.listingCount());
        Listing listing = store.findListing("realestate:149785064").orElseThrow();
        assertEquals(2, listing.getPriceHistory().size());
        assertEquals("realestate", listing.getSource());
        assertEquals(EventType.PRICE_DROPPED, store.events().get(0).getEventType());
    }

    @Test
    void shouldUseScrapedAtWhenObservationTimeMissing() {
        ObjectNode payload = domainPayload("1001", 800000, null).put("scrapedAt", "2024-11-01T08:30:00+11:00");

        service.ingest("domain", payload, null);

        assertEquals(OffsetDateTime.parse("2024-11-01T08:30:00+11:00"),
                store.findListing("domain:1001").orElseThrow().getCreatedAt());
    }

    // --- Rejections ---

    @Test
    void shouldRejectUnknownSource() {
        ObjectNode payload = domainPayload("1001", 800000, null);

        assertThrows(UnknownSourceException.class, () -> service.ingest("zillow", payload, T0));

        verify(rejectedSnapshotService).persistRejection(eq("zillow"), isNull(), eq(payload),
                eq(RejectionReason.UNKNOWN_SOURCE), eq(FailureStage.NORMALIZATION), anyString(), any());
        assertEquals(0, store.listingCount());
    }

    @Test
    void shouldRejectSnapshotWithoutIdentity() {
        ObjectNode payload = domainPayload("1001", 800000, null);
        payload.remove("suburb");

        NormalizationException ex = assertThrows(NormalizationException.class,
                () -> service.ingest("domain", payload, T0));

        assertEquals("suburb", ex.getField());
        verify(rejectedSnapshotService).persistRejection(eq("domain"), isNull(), eq(payload),
                eq(RejectionReason.MISSING_IDENTITY), eq(FailureStage.NORMALIZATION), contains("suburb"), any());
        assertEquals(0, store.commitAttempts());
    }

    // --- Conflicts ---

    @Test
    void shouldRetryConflictingCommit() {
        store.failNextCommits(2);

        IngestResult result = service.ingest("domain", domainPayload("1001", 800000, null), T0);

        assertEquals(IngestStatus.ACCEPTED, result.getStatus());
        assertEquals(3, store.commitAttempts());
        assertEquals(1, store.findListing("domain:1001").orElseThrow().getPriceHistory().size());
        verifyNoInteractions(rejectedSnapshotService);
    }

    @Test
    void shouldDeadLetterWhenConflictsPersist() {
        store.failNextCommits(10);

        assertThrows(ConflictException.class,
                () -> service.ingest("domain", domainPayload("1001", 800000, null), T0));

        assertEquals(4, store.commitAttempts());
        assertEquals(0, store.listingCount());
        verify(rejectedSnapshotService).persistRejection(eq("domain"), eq("domain:1001"), any(),
                eq(RejectionReason.CONFLICT), eq(FailureStage.PERSISTENCE), anyString(), any());
    }

    @Test
    void shouldSerializeConcurrentIngestionsOfOneListing() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(8);
        List<Future<IngestResult>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            int price = 800000 + i * 1000;
            futures.add(callers.submit(() -> service.ingest("domain", domainPayload("1001", price, null), T0)));
        }
        for (Future<IngestResult> future : futures) {
            assertEquals(IngestStatus.ACCEPTED, future.get(10, TimeUnit.SECONDS).getStatus());
        }
        callers.shutdown();

        Listing listing = store.findListing("domain:1001").orElseThrow();
        assertEquals(8, listing.getPriceHistory().size());
    }

    // --- Batch ---

    @Test
    void shouldApplyBatchInObservationOrderAndReportInRequestOrder() {
        List<SnapshotIngestionRequest> batch = List.of(
                request("domain", domainPayload("1001", 750000, null), T1),
                request("domain", domainPayload("2002", 500000, null), T0),
                request("zillow", domainPayload("3003", 1, null), T0),
                request("domain", domainPayload("1001", 800000, null), T0));

        BatchIngestionResponse response = service.ingestBatch(batch);

        assertEquals(4, response.getTotal());
        assertEquals(3, response.getAccepted());
        assertEquals(1, response.getRejected());
        assertEquals(0, response.getUnchanged());

        List<IngestResult> results = response.getResults();
        assertEquals("domain:1001", results.get(0).getListingId());
        assertEquals(1, results.get(0).getEvents().size());
        assertEquals("PRICE_DROPPED", results.get(0).getEvents().get(0).getEventType());
        assertEquals("domain:2002", results.get(1).getListingId());
        assertEquals(IngestStatus.REJECTED, results.get(2).getStatus());
        assertEquals("UNKNOWN_SOURCE", results.get(2).getReason());
        assertTrue(results.get(3).getEvents().isEmpty());

        Listing listing = store.findListing("domain:1001").orElseThrow();
        assertEquals(0, new BigDecimal("800000").compareTo(listing.getPreviousPrice()));
        assertEquals(0, new BigDecimal("750000").compareTo(listing.getCurrentPrice()));
    }

    @Test
    void shouldReportBatchConflictsPerItem() {
        store.failNextCommits(10);

        BatchIngestionResponse response = service.ingestBatch(List.of(
                request("domain", domainPayload("1001", 800000, null), T0)));

        assertEquals(1, response.getRejected());
        assertEquals("CONFLICT", response.getResults().get(0).getReason());
    }

    // --- Metrics ---

    @Test
    void shouldCountOutcomesBySource() {
        ObjectNode payload = domainPayload("1001", 800000, null);
        service.ingest("domain", payload, T0);
        service.ingest("domain", payload, T1);

        assertEquals(1.0, meterRegistry.get("listings.snapshots.received")
                .tag("source", "domain").tag("outcome", "accepted").counter().count());
        assertEquals(1.0, meterRegistry.get("listings.snapshots.received")
                .tag("source", "domain").tag("outcome", "unchanged").counter().count());
        assertEquals(2, meterRegistry.get("listings.ingestion.duration").timer().count());
    }

    private SnapshotIngestionRequest request(String source, ObjectNode payload, OffsetDateTime observedAt) {
        return SnapshotIngestionRequest.builder().source(source).payload(payload).observedAt(observedAt).build();
    }

    private ObjectNode domainPayload(String listingId, long price, String auctionAt) {
        ObjectNode payload = mapper.createObjectNode()
                .put("listingId", listingId)
                .put("streetNumber", "12")
                .put("street", "Smith Street")
                .put("suburb", "Richmond")
                .put("state", "VIC")
                .put("postcode", "3121")
                .put("propertyType", "House")
                .put("beds", 3)
                .put("baths", 2);
        payload.putObject("priceDetails").put("price", price);
        if (auctionAt != null) {
            payload.putObject("auctionSchedule").put("openingDateTime", auctionAt).put("status", "Scheduled");
        }
        return payload;
    }

    private ObjectNode realestatePayload(String id, String displayPrice) {
        ObjectNode payload = mapper.createObjectNode().put("id", id).put("propertyType", "house");
        payload.putObject("address").put("suburb", "Richmond").put("state", "VIC").put("postcode", "3121");
        payload.putObject("price").put("display", displayPrice);
        return payload;
    }
}

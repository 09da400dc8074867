package org.listingwatch.tracker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.listingwatch.tracker.domain.model.RejectedSnapshot;
import org.listingwatch.tracker.domain.model.enums.FailureStage;
import org.listingwatch.tracker.domain.model.enums.RejectionReason;
import org.listingwatch.tracker.domain.repository.RejectedSnapshotRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RejectedSnapshotServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private RejectedSnapshotRepository repository;
    private RejectedSnapshotService service;

    @BeforeEach
    void setUp() {
        repository = mock(RejectedSnapshotRepository.class);
        when(repository.save(any(RejectedSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));
        service = new RejectedSnapshotService(repository, mapper);
    }

    // --- persistRejection ---

    @Test
    void shouldStoreObjectPayloadAsMap() {
        ObjectNode payload = mapper.createObjectNode().put("listingId", "1001").put("suburb", "Richmond");

        RejectedSnapshot saved = service.persistRejection("domain", "domain:1001", payload,
                RejectionReason.CONFLICT, FailureStage.PERSISTENCE, "still conflicting", "corr-1");

        assertEquals("domain", saved.getSource());
        assertEquals("domain:1001", saved.getListingId());
        assertEquals("Richmond", saved.getRawPayload().get("suburb"));
        assertEquals(RejectionReason.CONFLICT, saved.getRejectionReason());
        assertEquals(FailureStage.PERSISTENCE, saved.getFailureStage());
        assertEquals("corr-1", saved.getCorrelationId());
        assertFalse(saved.isResolved());
        assertNotNull(saved.getReceivedAt());
    }

    @Test
    void shouldWrapNonObjectPayload() {
        RejectedSnapshot saved = service.persistRejection(null, null, mapper.createArrayNode().add(1).add(2),
                RejectionReason.MISSING_IDENTITY, FailureStage.NORMALIZATION, "payload: not an object", null);

        assertEquals("unknown", saved.getSource());
        assertEquals(Map.of("payload", List.of(1, 2)), saved.getRawPayload());
    }

    @Test
    void shouldKeepMissingPayloadNull() {
        RejectedSnapshot saved = service.persistRejection("domain", null, null,
                RejectionReason.MISSING_IDENTITY, FailureStage.NORMALIZATION, "payload: missing", null);

        assertNull(saved.getRawPayload());
    }

    // --- resolve ---

    @Test
    void shouldMarkResolved() {
        UUID id = UUID.randomUUID();
        RejectedSnapshot rejected = RejectedSnapshot.builder().id(id).source("domain")
                .rejectionReason(RejectionReason.INVALID_STATE).failureStage(FailureStage.AGGREGATE).build();
        when(repository.findById(id)).thenReturn(Optional.of(rejected));

        RejectedSnapshot resolved = service.resolve(id).orElseThrow();

        assertTrue(resolved.isResolved());
        assertNotNull(resolved.getResolvedAt());
        verify(repository).save(rejected);
    }

    @Test
    void shouldReturnEmptyWhenResolvingUnknownId() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.empty());

        assertTrue(service.resolve(id).isEmpty());
        verify(repository, never()).save(any());
    }
}

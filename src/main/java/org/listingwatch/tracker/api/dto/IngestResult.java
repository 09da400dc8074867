package org.listingwatch.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.listingwatch.tracker.domain.model.enums.IngestStatus;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Outcome of ingesting one snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestResult {

    private String listingId;
    private IngestStatus status;
    private List<ListingEventMessage> events;
    private OffsetDateTime receivedAt;
    private String reason;          // only set for rejected snapshots in a batch
    private String details;         // only set for rejected snapshots in a batch

    public static IngestResult accepted(String listingId, List<ListingEventMessage> events, OffsetDateTime receivedAt) {
        return IngestResult.builder()
                .listingId(listingId)
                .status(IngestStatus.ACCEPTED)
                .events(events)
                .receivedAt(receivedAt)
                .build();
    }

    public static IngestResult unchanged(String listingId, OffsetDateTime receivedAt) {
        return IngestResult.builder()
                .listingId(listingId)
                .status(IngestStatus.UNCHANGED)
                .events(List.of())
                .receivedAt(receivedAt)
                .build();
    }

    public static IngestResult rejected(String listingId, String reason, String details, OffsetDateTime receivedAt) {
        return IngestResult.builder()
                .listingId(listingId)
                .status(IngestStatus.REJECTED)
                .reason(reason)
                .details(details)
                .receivedAt(receivedAt)
                .build();
    }

    @JsonIgnore
    public boolean isUnchanged() {
        return status == IngestStatus.UNCHANGED;
    }
}

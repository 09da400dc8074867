package org.listingwatch.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.listingwatch.tracker.domain.model.ListingEvent;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Wire form of a listing event, used on the Kafka topic and in ingestion responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ListingEventMessage {

    private UUID id;
    private String listingId;
    private String eventType;
    private OffsetDateTime timestamp;
    private Map<String, Object> metadata;
    private OffsetDateTime recordedAt;

    public static ListingEventMessage from(ListingEvent event) {
        return ListingEventMessage.builder()
                .id(event.getId())
                .listingId(event.getListingId())
                .eventType(event.getEventType().name())
                .timestamp(event.getTimestamp())
                .metadata(event.getMetadata())
                .recordedAt(event.getRecordedAt())
                .build();
    }
}

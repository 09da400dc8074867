package org.listingwatch.tracker.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.listingwatch.tracker.domain.model.enums.EventType;
import org.listingwatch.tracker.domain.model.enums.PublishStatus;
import org.listingwatch.tracker.domain.model.metadata.EventMetadata;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A fact derived from a listing transition. The fact columns (type, listing, timestamp,
 * metadata) are immutable; only the Kafka publish tracking columns change after insert.
 * References the listing by id only.
 */
@Entity
@Table(name = "listing_event")
@Getter
@ToString(exclude = "metadata")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ListingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "listing_id", nullable = false, updatable = false)
    private String listingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private EventType eventType;

    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private OffsetDateTime timestamp;

    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private OffsetDateTime recordedAt;

    // position within the commit that stored it; breaks ties between events with equal recordedAt
    @Column(name = "record_sequence", nullable = false, updatable = false)
    private int recordSequence;

    // Kafka publish tracking
    @Enumerated(EnumType.STRING)
    @Column(name = "publish_status", nullable = false)
    private PublishStatus publishStatus = PublishStatus.PENDING;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "kafka_topic")
    private String kafkaTopic;

    @Column(name = "kafka_partition")
    private Integer kafkaPartition;

    @Column(name = "kafka_offset")
    private Long kafkaOffset;

    private ListingEvent(EventType eventType, String listingId, OffsetDateTime timestamp,
                         Map<String, Object> metadata) {
        this.eventType = eventType;
        this.listingId = listingId;
        this.timestamp = timestamp;
        this.metadata = metadata;
    }

    /**
     * Create an event. {@code timestamp} may be null; timelines assign one on add.
     *
     * @throws IllegalArgumentException if the metadata shape does not belong to the event type
     */
    public static ListingEvent of(EventType eventType, String listingId, OffsetDateTime timestamp,
                                  EventMetadata metadata) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(listingId, "listingId");
        if (!eventType.accepts(metadata)) {
            throw new IllegalArgumentException("Event type " + eventType + " requires metadata of type "
                    + eventType.getMetadataType().getSimpleName());
        }
        return new ListingEvent(eventType, listingId, timestamp, metadata.toMap());
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void assignTimestampIfAbsent(OffsetDateTime now) {
        if (timestamp == null) {
            timestamp = now;
        }
    }

    public void markRecorded(OffsetDateTime now) {
        markRecorded(now, 0);
    }

    /**
     * Stamp the storage time and the event's position among the events stored with it.
     * Only the first call has an effect.
     */
    public void markRecorded(OffsetDateTime now, int sequence) {
        if (recordedAt == null) {
            recordedAt = now;
            recordSequence = sequence;
        }
    }

    public void markPublished(String topic, int partition, long offset, OffsetDateTime at) {
        this.publishStatus = PublishStatus.PUBLISHED;
        this.kafkaTopic = topic;
        this.kafkaPartition = partition;
        this.kafkaOffset = offset;
        this.publishedAt = at;
    }

    public void markPublishFailed() {
        this.publishStatus = PublishStatus.FAILED;
    }
}

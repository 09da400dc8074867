package org.listingwatch.tracker.kafka;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.listingwatch.tracker.api.dto.ListingEventMessage;
import org.listingwatch.tracker.api.exception.EventPublishException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes listing events to the timeline topic, keyed by listing id so that each
 * listing's events stay in order within one partition.
 */
@Service
@Slf4j
public class ListingEventProducer {

    private final KafkaTemplate<String, ListingEventMessage> kafkaTemplate;
    private final String eventsTopic;

    public ListingEventProducer(KafkaTemplate<String, ListingEventMessage> kafkaTemplate,
                                @Value("${listings.kafka.topics.events:listings.events.timeline}") String eventsTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.eventsTopic = eventsTopic;
    }

    public CompletableFuture<RecordMetadata> publish(ListingEventMessage event) {
        return kafkaTemplate.send(eventsTopic, event.getListingId(), event)
                .thenApply(result -> {
                    RecordMetadata metadata = result.getRecordMetadata();
                    log.info("Published {} for {} to {}[{}]@{}", event.getEventType(), event.getListingId(),
                            metadata.topic(), metadata.partition(), metadata.offset());
                    return metadata;
                })
                .exceptionally(ex -> {
                    log.error("Failed to publish event {} to Kafka", event.getId(), ex);
                    throw new EventPublishException(event, ex);
                });
    }
}

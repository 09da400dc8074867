package org.listingwatch.tracker.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.listingwatch.tracker.api.dto.ListingEventMessage;
import org.listingwatch.tracker.domain.model.ListingEvent;
import org.listingwatch.tracker.domain.model.enums.PublishStatus;
import org.listingwatch.tracker.domain.repository.ListingEventRepository;
import org.listingwatch.tracker.kafka.ListingEventProducer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Publishes committed listing events to Kafka (outbox pattern): the event row carries its
 * publish status, and rows left PENDING or FAILED are retried on a schedule.
 */
@Service
@Slf4j
public class ListingEventPublisher {

    private static final Comparator<ListingEvent> STORAGE_ORDER =
            Comparator.comparing(ListingEvent::getRecordedAt).thenComparingInt(ListingEvent::getRecordSequence);

    private final ListingEventProducer listingEventProducer;
    private final ListingEventRepository listingEventRepository;
    private final int retryMaxAgeMinutes;

    public ListingEventPublisher(ListingEventProducer listingEventProducer,
                                 ListingEventRepository listingEventRepository,
                                 @Value("${listings.outbox.retry-max-age-minutes:60}") int retryMaxAgeMinutes) {
        this.listingEventProducer = listingEventProducer;
        this.listingEventRepository = listingEventRepository;
        this.retryMaxAgeMinutes = retryMaxAgeMinutes;
    }

    /**
     * Publish one committed event and record the outcome on its row.
     *
     * @throws RuntimeException if Kafka rejected the record; the row is then marked FAILED
     */
    public ListingEventMessage publish(ListingEvent event) {
        ListingEventMessage message = ListingEventMessage.from(event);
        try {
            RecordMetadata metadata = listingEventProducer.publish(message).join();
            event.markPublished(metadata.topic(), metadata.partition(), metadata.offset(),
                    OffsetDateTime.now(ZoneOffset.UTC));
            listingEventRepository.save(event);
            return message;
        } catch (RuntimeException e) {
            log.error("Kafka publish failed for listing_event id={}: {}", event.getId(), e.getMessage());
            event.markPublishFailed();
            listingEventRepository.save(event);
            throw e;
        }
    }

    /**
     * Publish events in order, stopping at the first failure so later events of the same
     * listing are not published ahead of an earlier one. Unpublished rows are left for retry.
     *
     * @return the number of events published
     */
    public int publishAll(List<ListingEvent> events) {
        int published = 0;
        for (ListingEvent event : events) {
            try {
                publish(event);
                published++;
            } catch (RuntimeException e) {
                log.warn("Deferring {} unpublished event(s) of listing {} to retry",
                        events.size() - published, event.getListingId());
                break;
            }
        }
        return published;
    }

    /**
     * Scheduled retry of pending and failed events in the order they were stored. Once an
     * event of a listing fails, the rest of that listing's events wait for the next run.
     */
    @Scheduled(fixedDelayString = "${listings.outbox.retry-interval-seconds:30}000")
    public void retryPendingPublishes() {
        OffsetDateTime cutoff = OffsetDateTime.now(ZoneOffset.UTC).minusSeconds(30);
        OffsetDateTime maxAge = OffsetDateTime.now(ZoneOffset.UTC).minusMinutes(retryMaxAgeMinutes);

        List<ListingEvent> retryable = new ArrayList<>(listingEventRepository.findByPublishStatusInAndRecordedAtBefore(
                List.of(PublishStatus.PENDING, PublishStatus.FAILED), cutoff));
        retryable.sort(STORAGE_ORDER);

        Set<String> blockedListings = new HashSet<>();
        for (ListingEvent event : retryable) {
            if (blockedListings.contains(event.getListingId())) {
                continue;
            }
            if (event.getRecordedAt().isBefore(maxAge)) {
                log.warn("listing_event id={} exceeded max retry age, skipping", event.getId());
                continue;
            }
            try {
                publish(event);
                log.info("Successfully retried publish for listing_event id={}", event.getId());
            } catch (RuntimeException e) {
                blockedListings.add(event.getListingId());
                log.warn("Retry publish failed for listing_event id={}, holding back later events of listing {}: {}",
                        event.getId(), event.getListingId(), e.getMessage());
            }
        }
    }
}

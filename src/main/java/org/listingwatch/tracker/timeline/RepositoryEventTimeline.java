package org.listingwatch.tracker.timeline;

import lombok.RequiredArgsConstructor;
import org.listingwatch.tracker.domain.model.ListingEvent;
import org.listingwatch.tracker.domain.model.enums.EventType;
import org.listingwatch.tracker.domain.repository.ListingEventRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Event timeline over the {@code listing_event} table. Events with equal timestamps are
 * ordered by the time they were stored, then by their position within the storing commit.
 */
@Service
@RequiredArgsConstructor
public class RepositoryEventTimeline implements EventTimeline {

    private final ListingEventRepository listingEventRepository;

    @Override
    @Transactional
    public ListingEvent add(ListingEvent event) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        event.assignTimestampIfAbsent(now);
        event.markRecorded(now);
        return listingEventRepository.save(event);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ListingEvent> query(String listingId, EventType eventType, Integer limit) {
        if (limit != null && limit <= 0) {
            return List.of();
        }
        Pageable page = page(limit);
        if (eventType == null) {
            return listingEventRepository.findByListingIdOrderByTimestampDescRecordedAtDescRecordSequenceDesc(
                    listingId, page);
        }
        return listingEventRepository.findByListingIdAndEventTypeOrderByTimestampDescRecordedAtDescRecordSequenceDesc(
                listingId, eventType, page);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ListingEvent> queryAll(EventType eventType, Integer limit) {
        if (limit != null && limit <= 0) {
            return List.of();
        }
        Pageable page = page(limit);
        if (eventType == null) {
            return listingEventRepository.findAllByOrderByTimestampDescRecordedAtDescRecordSequenceDesc(page);
        }
        return listingEventRepository.findByEventTypeOrderByTimestampDescRecordedAtDescRecordSequenceDesc(
                eventType, page);
    }

    @Override
    @Transactional(readOnly = true)
    public long count(String listingId, EventType eventType) {
        if (listingId != null && eventType != null) {
            return listingEventRepository.countByListingIdAndEventType(listingId, eventType);
        }
        if (listingId != null) {
            return listingEventRepository.countByListingId(listingId);
        }
        if (eventType != null) {
            return listingEventRepository.countByEventType(eventType);
        }
        return listingEventRepository.count();
    }

    private static Pageable page(Integer limit) {
        if (limit == null) {
            return Pageable.unpaged();
        }
        return PageRequest.of(0, limit);
    }
}

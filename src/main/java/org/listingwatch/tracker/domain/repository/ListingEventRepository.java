package org.listingwatch.tracker.domain.repository;

import org.listingwatch.tracker.domain.model.ListingEvent;
import org.listingwatch.tracker.domain.model.enums.EventType;
import org.listingwatch.tracker.domain.model.enums.PublishStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ListingEventRepository extends JpaRepository<ListingEvent, UUID> {

    List<ListingEvent> findByListingIdOrderByTimestampDescRecordedAtDescRecordSequenceDesc(
            String listingId, Pageable pageable);

    List<ListingEvent> findByListingIdAndEventTypeOrderByTimestampDescRecordedAtDescRecordSequenceDesc(
            String listingId, EventType eventType, Pageable pageable);

    List<ListingEvent> findAllByOrderByTimestampDescRecordedAtDescRecordSequenceDesc(Pageable pageable);

    List<ListingEvent> findByEventTypeOrderByTimestampDescRecordedAtDescRecordSequenceDesc(
            EventType eventType, Pageable pageable);

    List<ListingEvent> findByPublishStatusInAndRecordedAtBefore(
            Collection<PublishStatus> publishStatuses, OffsetDateTime cutoff);

    long countByListingId(String listingId);

    long countByEventType(EventType eventType);

    long countByListingIdAndEventType(String listingId, EventType eventType);
}

package org.listingwatch.tracker.timeline;

import lombok.Value;
import org.listingwatch.tracker.domain.model.ListingEvent;
import org.listingwatch.tracker.domain.model.enums.EventType;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Stream;

/**
 * Thread-safe in-memory timeline. The ingestion pipeline uses one per call to stage the
 * events a snapshot produces before they are committed with the listing.
 */
public class InMemoryEventTimeline implements EventTimeline {

    private static final Comparator<Indexed> NEWEST_FIRST =
            Comparator.comparing((Indexed i) -> i.getEvent().getTimestamp())
                    .thenComparingLong(Indexed::getSequence)
                    .reversed();

    private final Clock clock;
    private final List<Indexed> events = new ArrayList<>();
    private final Map<String, List<Indexed>> eventsByListing = new HashMap<>();
    private long sequence;

    public InMemoryEventTimeline() {
        this(Clock.systemUTC());
    }

    public InMemoryEventTimeline(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ListingEvent add(ListingEvent event) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        event.assignTimestampIfAbsent(now);
        Indexed indexed = new Indexed(event, sequence++);
        events.add(indexed);
        eventsByListing.computeIfAbsent(event.getListingId(), k -> new ArrayList<>()).add(indexed);
        return event;
    }

    @Override
    public synchronized List<ListingEvent> query(String listingId, EventType eventType, Integer limit) {
        return select(eventsByListing.getOrDefault(listingId, List.of()).stream(), eventType, limit);
    }

    @Override
    public synchronized List<ListingEvent> queryAll(EventType eventType, Integer limit) {
        return select(events.stream(), eventType, limit);
    }

    @Override
    public synchronized long count(String listingId, EventType eventType) {
        Stream<Indexed> source = listingId != null
                ? eventsByListing.getOrDefault(listingId, List.of()).stream()
                : events.stream();
        return source.filter(i -> eventType == null || i.getEvent().getEventType() == eventType).count();
    }

    /**
     * All events in the order they were added.
     */
    public synchronized List<ListingEvent> recorded() {
        return events.stream().map(Indexed::getEvent).toList();
    }

    public synchronized int size() {
        return events.size();
    }

    private List<ListingEvent> select(Stream<Indexed> source, EventType eventType, Integer limit) {
        Stream<Indexed> selected = source
                .filter(i -> eventType == null || i.getEvent().getEventType() == eventType)
                .sorted(NEWEST_FIRST);
        if (limit != null) {
            selected = selected.limit(Math.max(0, limit));
        }
        return selected.map(Indexed::getEvent).toList();
    }

    @Value
    private static class Indexed {
        ListingEvent event;
        long sequence;
    }
}

package org.listingwatch.tracker.timeline;

import org.listingwatch.tracker.domain.model.ListingEvent;
import org.listingwatch.tracker.domain.model.enums.EventType;

import java.util.List;
import java.util.Optional;

/**
 * Append-only log of listing events, indexed by listing id and event type.
 * Every read reflects all previously completed {@link #add} calls.
 * Query results are ordered by event timestamp, most recent first. A null query limit
 * means no limit; a limit of zero or less yields an empty list.
 */
public interface EventTimeline {

    /**
     * Append an event, assigning the current time if it has no timestamp.
     *
     * @return the appended event
     */
    ListingEvent add(ListingEvent event);

    /**
     * Events of one listing, optionally filtered by type and truncated to {@code limit}.
     *
     * @param eventType null for all types
     * @param limit     null for no limit, zero or less for an empty result
     */
    List<ListingEvent> query(String listingId, EventType eventType, Integer limit);

    default List<ListingEvent> query(String listingId) {
        return query(listingId, null, null);
    }

    /**
     * Events across all listings, optionally filtered by type and truncated. {@code limit}
     * follows the same rule as {@link #query(String, EventType, Integer)}.
     */
    List<ListingEvent> queryAll(EventType eventType, Integer limit);

    default Optional<ListingEvent> latest(String listingId) {
        return latest(listingId, null);
    }

    default Optional<ListingEvent> latest(String listingId, EventType eventType) {
        return query(listingId, eventType, 1).stream().findFirst();
    }

    default boolean has(String listingId, EventType eventType) {
        return count(listingId, eventType) > 0;
    }

    /**
     * Count events; either filter may be null.
     */
    long count(String listingId, EventType eventType);
}

package org.listingwatch.tracker.store;

import org.listingwatch.tracker.api.exception.ConflictException;
import org.listingwatch.tracker.domain.model.Listing;
import org.listingwatch.tracker.domain.model.ListingEvent;

import java.util.List;
import java.util.Optional;

/**
 * Storage port of the ingestion pipeline.
 */
public interface ListingStore {

    Optional<Listing> findListing(String listingId);

    Listing saveListing(Listing listing);

    List<ListingEvent> appendEvents(List<ListingEvent> events);

    Optional<String> findLastFingerprint(String listingId);

    void saveFingerprint(String listingId, String fingerprint);

    /**
     * Save the listing, append its new events and record the fingerprint as one atomic unit.
     *
     * @throws ConflictException if a concurrent write to the same listing won
     */
    Listing commit(Listing listing, List<ListingEvent> events, String fingerprint);
}

package org.listingwatch.tracker.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.api.exception.ConflictException;
import org.listingwatch.tracker.domain.model.Listing;
import org.listingwatch.tracker.domain.model.ListingEvent;
import org.listingwatch.tracker.domain.model.ListingFingerprint;
import org.listingwatch.tracker.domain.repository.ListingEventRepository;
import org.listingwatch.tracker.domain.repository.ListingFingerprintRepository;
import org.listingwatch.tracker.domain.repository.ListingRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * {@link ListingStore} over Spring Data JPA. Writes are flushed inside the transaction so
 * version and primary-key conflicts surface here as {@link ConflictException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaListingStore implements ListingStore {

    private final ListingRepository listingRepository;
    private final ListingEventRepository listingEventRepository;
    private final ListingFingerprintRepository listingFingerprintRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Listing> findListing(String listingId) {
        return listingRepository.findById(listingId);
    }

    @Override
    @Transactional
    public Listing saveListing(Listing listing) {
        try {
            return listingRepository.saveAndFlush(listing);
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new ConflictException(listing.getListingId(), "Concurrent write to listing", e);
        }
    }

    @Override
    @Transactional
    public List<ListingEvent> appendEvents(List<ListingEvent> events) {
        if (events.isEmpty()) {
            return events;
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        for (int i = 0; i < events.size(); i++) {
            events.get(i).markRecorded(now, i);
        }
        return listingEventRepository.saveAllAndFlush(events);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findLastFingerprint(String listingId) {
        return listingFingerprintRepository.findById(listingId).map(ListingFingerprint::getFingerprint);
    }

    @Override
    @Transactional
    public void saveFingerprint(String listingId, String fingerprint) {
        ListingFingerprint record = listingFingerprintRepository.findById(listingId)
                .orElseGet(() -> ListingFingerprint.builder().listingId(listingId).build());
        record.setFingerprint(fingerprint);
        record.setRecordedAt(OffsetDateTime.now(ZoneOffset.UTC));
        try {
            listingFingerprintRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(listingId, "Concurrent fingerprint write", e);
        }
    }

    @Override
    @Transactional
    public Listing commit(Listing listing, List<ListingEvent> events, String fingerprint) {
        Listing saved = saveListing(listing);
        appendEvents(events);
        saveFingerprint(listing.getListingId(), fingerprint);
        log.debug("Committed listing {} (version {}) with {} new event(s)",
                saved.getListingId(), saved.getVersion(), events.size());
        return saved;
    }
}

package org.listingwatch.tracker.domain.repository;

import org.listingwatch.tracker.domain.model.ListingFingerprint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ListingFingerprintRepository extends JpaRepository<ListingFingerprint, String> {
}

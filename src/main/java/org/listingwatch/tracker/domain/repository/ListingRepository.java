package org.listingwatch.tracker.domain.repository;

import org.listingwatch.tracker.domain.model.Listing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ListingRepository extends JpaRepository<Listing, String> {
}

package org.listingwatch.tracker.domain.repository;

import org.listingwatch.tracker.domain.model.RejectedSnapshot;
import org.listingwatch.tracker.domain.model.enums.RejectionReason;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface RejectedSnapshotRepository extends JpaRepository<RejectedSnapshot, UUID> {

    Page<RejectedSnapshot> findByResolvedFalse(Pageable pageable);

    Page<RejectedSnapshot> findByRejectionReason(RejectionReason reason, Pageable pageable);

    Page<RejectedSnapshot> findBySource(String source, Pageable pageable);
}

package org.listingwatch.tracker.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Content fingerprint of the last snapshot applied to a listing.
 */
@Entity
@Table(name = "listing_fingerprint")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ListingFingerprint {

    @Id
    @Column(name = "listing_id")
    private String listingId;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "recorded_at", nullable = false)
    private OffsetDateTime recordedAt;
}

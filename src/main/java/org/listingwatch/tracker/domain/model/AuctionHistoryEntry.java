package org.listingwatch.tracker.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.listingwatch.tracker.domain.model.enums.ListingStatus;

import java.time.OffsetDateTime;

/**
 * One recorded auction state of a listing. Never modified once appended.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AuctionHistoryEntry {

    @Column(name = "auction_datetime")
    private OffsetDateTime auctionDatetime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ListingStatus status;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "observed_at", nullable = false)
    private OffsetDateTime observedAt;
}

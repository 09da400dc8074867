package org.listingwatch.tracker.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.listingwatch.tracker.api.exception.InvalidStateException;
import org.listingwatch.tracker.domain.model.enums.EventType;
import org.listingwatch.tracker.domain.model.enums.ListingStatus;
import org.listingwatch.tracker.domain.model.enums.PropertyType;
import org.listingwatch.tracker.domain.model.metadata.AuctionRescheduledMetadata;
import org.listingwatch.tracker.domain.model.metadata.AuctionStatusMetadata;
import org.listingwatch.tracker.domain.model.metadata.PriceDroppedMetadata;
import org.listingwatch.tracker.normalizer.CanonicalSnapshot;
import org.listingwatch.tracker.timeline.EventTimeline;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Listing aggregate: current state plus append-only price and auction histories.
 * <p>
 * Histories are kept in chronological order; the public getters return them most recent first.
 * State changes only through {@link #applyDescriptive}, {@link #applyPrice} and
 * {@link #applyAuction}, which are no-ops when called again with the same input.
 */
@Entity
@Table(name = "listing")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Listing {

    @Id
    @Column(name = "listing_id", nullable = false, updatable = false)
    private String listingId;

    @Version
    private Long version;

    @Embedded
    private Address address;

    @Column(nullable = false)
    private String suburb;

    @Enumerated(EnumType.STRING)
    @Column(name = "property_type", nullable = false)
    private PropertyType propertyType = PropertyType.OTHER;

    private Integer bedrooms;

    private Integer bathrooms;

    @Column(name = "land_size", precision = 14, scale = 2)
    private BigDecimal landSize;

    @Column(name = "building_size", precision = 14, scale = 2)
    private BigDecimal buildingSize;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ListingStatus status = ListingStatus.UNKNOWN;

    @Column(name = "current_price", precision = 14, scale = 2)
    private BigDecimal currentPrice;

    @Column(name = "previous_price", precision = 14, scale = 2)
    private BigDecimal previousPrice;

    @Column(name = "auction_datetime")
    private OffsetDateTime auctionDatetime;

    @Getter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "listing_price_history", joinColumns = @JoinColumn(name = "listing_id"))
    @OrderColumn(name = "entry_index")
    private List<PriceHistoryEntry> priceHistory = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "listing_auction_history", joinColumns = @JoinColumn(name = "listing_id"))
    @OrderColumn(name = "entry_index")
    private List<AuctionHistoryEntry> auctionHistory = new ArrayList<>();

    @Column(name = "property_link", length = 1024)
    private String propertyLink;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(nullable = false)
    private String source;

    private Listing(String listingId, OffsetDateTime createdAt) {
        this.listingId = listingId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * A listing seen for the first time at {@code observedAt}.
     */
    public static Listing create(String listingId, OffsetDateTime observedAt) {
        Objects.requireNonNull(listingId, "listingId");
        Objects.requireNonNull(observedAt, "observedAt");
        return new Listing(listingId, observedAt);
    }

    /**
     * Price history, most recent first.
     */
    public List<PriceHistoryEntry> getPriceHistory() {
        List<PriceHistoryEntry> copy = new ArrayList<>(priceHistory);
        Collections.reverse(copy);
        return Collections.unmodifiableList(copy);
    }

    /**
     * Auction history, most recent first.
     */
    public List<AuctionHistoryEntry> getAuctionHistory() {
        List<AuctionHistoryEntry> copy = new ArrayList<>(auctionHistory);
        Collections.reverse(copy);
        return Collections.unmodifiableList(copy);
    }

    public List<PriceHistoryEntry> getPriceHistoryChronological() {
        return Collections.unmodifiableList(priceHistory);
    }

    public List<AuctionHistoryEntry> getAuctionHistoryChronological() {
        return Collections.unmodifiableList(auctionHistory);
    }

    /**
     * Overwrite the descriptive fields with the snapshot's values (last write wins, no history).
     */
    public void applyDescriptive(CanonicalSnapshot snapshot) {
        this.address = snapshot.getAddress();
        this.suburb = snapshot.getAddress().getSuburb();
        this.propertyType = snapshot.getPropertyType() != null ? snapshot.getPropertyType() : PropertyType.OTHER;
        this.bedrooms = snapshot.getBedrooms();
        this.bathrooms = snapshot.getBathrooms();
        this.landSize = snapshot.getLandSize();
        this.buildingSize = snapshot.getBuildingSize();
        this.propertyLink = snapshot.getPropertyLink();
        this.description = snapshot.getDescription();
        this.source = snapshot.getSourceId();
    }

    /**
     * Record a newly observed price.
     *
     * @param timeline receives a PRICE_DROPPED event when the price went down; may be null
     * @return true if the price history changed
     * @throws InvalidStateException for a negative price, or a drop against a zero base price
     */
    public boolean applyPrice(BigDecimal newPrice, OffsetDateTime observedAt, EventTimeline timeline) {
        Objects.requireNonNull(observedAt, "observedAt");
        if (newPrice == null) {
            return false;
        }
        if (currentPrice != null && newPrice.compareTo(currentPrice) == 0) {
            return false;
        }
        boolean alreadySeen = priceHistory.stream()
                .anyMatch(e -> e.getPrice().compareTo(newPrice) == 0 && !observedAt.isAfter(e.getObservedAt()));
        if (alreadySeen || isStale(observedAt, lastPriceEntryAt())) {
            return false;
        }
        if (newPrice.signum() < 0) {
            throw new InvalidStateException(listingId, "Price must not be negative: " + newPrice);
        }

        // metadata first so an invalid drop leaves the listing untouched
        PriceDroppedMetadata drop = null;
        if (currentPrice != null && newPrice.compareTo(currentPrice) < 0) {
            drop = PriceDroppedMetadata.of(listingId, currentPrice, newPrice);
        }

        priceHistory.add(new PriceHistoryEntry(newPrice, observedAt));
        previousPrice = currentPrice;
        currentPrice = newPrice;

        if (drop != null && timeline != null) {
            timeline.add(ListingEvent.of(EventType.PRICE_DROPPED, listingId, observedAt, drop));
        }
        return true;
    }

    public boolean applyPrice(BigDecimal newPrice, OffsetDateTime observedAt) {
        return applyPrice(newPrice, observedAt, null);
    }

    /**
     * Record a newly observed auction status and date. Emits at most one event:
     * cancellation, then voiding, then rescheduling, first match wins.
     *
     * @param timeline receives the derived event, if any; may be null
     * @return true if the auction history changed
     */
    public boolean applyAuction(ListingStatus newStatus, OffsetDateTime newDatetime, OffsetDateTime observedAt,
                                String notes, EventTimeline timeline) {
        Objects.requireNonNull(observedAt, "observedAt");
        ListingStatus targetStatus = newStatus != null ? newStatus : ListingStatus.UNKNOWN;
        if (targetStatus == status && sameInstant(newDatetime, auctionDatetime)) {
            return false;
        }
        if (isStale(observedAt, lastAuctionEntryAt())) {
            return false;
        }

        ListingStatus previousStatus = status;
        OffsetDateTime previousDatetime = auctionDatetime;

        auctionHistory.add(new AuctionHistoryEntry(newDatetime, targetStatus, notes, observedAt));
        status = targetStatus;
        auctionDatetime = newDatetime;

        ListingEvent event = null;
        if (targetStatus == ListingStatus.CANCELLED && previousStatus != ListingStatus.CANCELLED) {
            event = ListingEvent.of(EventType.AUCTION_CANCELLED, listingId, observedAt,
                    new AuctionStatusMetadata(previousStatus, coalesce(newDatetime, previousDatetime), notes));
        } else if (targetStatus == ListingStatus.VOIDED && previousStatus != ListingStatus.VOIDED) {
            event = ListingEvent.of(EventType.AUCTION_VOIDED, listingId, observedAt,
                    new AuctionStatusMetadata(previousStatus, coalesce(newDatetime, previousDatetime), notes));
        } else if (targetStatus == ListingStatus.SCHEDULED && previousDatetime != null
                && newDatetime != null && !newDatetime.isEqual(previousDatetime)) {
            event = ListingEvent.of(EventType.AUCTION_RESCHEDULED, listingId, observedAt,
                    new AuctionRescheduledMetadata(previousDatetime, newDatetime, notes));
        }

        if (event != null && timeline != null) {
            timeline.add(event);
        }
        return true;
    }

    public boolean applyAuction(ListingStatus newStatus, OffsetDateTime newDatetime, OffsetDateTime observedAt) {
        return applyAuction(newStatus, newDatetime, observedAt, null, null);
    }

    public void markUpdated(OffsetDateTime at) {
        if (updatedAt == null || at.isAfter(updatedAt)) {
            this.updatedAt = at;
        }
    }

    private OffsetDateTime lastPriceEntryAt() {
        return priceHistory.isEmpty() ? null : priceHistory.get(priceHistory.size() - 1).getObservedAt();
    }

    private OffsetDateTime lastAuctionEntryAt() {
        return auctionHistory.isEmpty() ? null : auctionHistory.get(auctionHistory.size() - 1).getObservedAt();
    }

    // appending an older observation would break chronological order
    private static boolean isStale(OffsetDateTime observedAt, OffsetDateTime lastEntryAt) {
        return lastEntryAt != null && observedAt.isBefore(lastEntryAt);
    }

    private static boolean sameInstant(OffsetDateTime a, OffsetDateTime b) {
        return a == null ? b == null : b != null && a.isEqual(b);
    }

    private static OffsetDateTime coalesce(OffsetDateTime first, OffsetDateTime second) {
        return first != null ? first : second;
    }
}

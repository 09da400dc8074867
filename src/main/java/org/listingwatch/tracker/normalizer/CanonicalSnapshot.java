package org.listingwatch.tracker.normalizer;

import lombok.Builder;
import lombok.Value;
import org.listingwatch.tracker.domain.model.Address;
import org.listingwatch.tracker.domain.model.enums.ListingStatus;
import org.listingwatch.tracker.domain.model.enums.PropertyType;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One source snapshot mapped onto the canonical listing fields.
 * Only {@code sourceId}, {@code listingId} and {@code address} are guaranteed non-null.
 */
@Value
@Builder
public class CanonicalSnapshot {

    String sourceId;
    String listingId;
    Address address;
    PropertyType propertyType;
    Integer bedrooms;
    Integer bathrooms;
    BigDecimal landSize;
    BigDecimal buildingSize;
    BigDecimal price;
    @Builder.Default
    ListingStatus status = ListingStatus.UNKNOWN;
    OffsetDateTime auctionDatetime;
    String auctionNotes;
    String propertyLink;
    String description;

    /**
     * When the scraper captured the payload, if it said so.
     */
    OffsetDateTime observedAt;
}

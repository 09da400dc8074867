package org.listingwatch.tracker.domain.model.enums;

import org.listingwatch.tracker.domain.model.metadata.AuctionRescheduledMetadata;
import org.listingwatch.tracker.domain.model.metadata.AuctionStatusMetadata;
import org.listingwatch.tracker.domain.model.metadata.EventMetadata;
import org.listingwatch.tracker.domain.model.metadata.PriceDroppedMetadata;

/**
 * Listing event types, each bound to the metadata shape it carries.
 */
public enum EventType {
    AUCTION_CANCELLED(AuctionStatusMetadata.class),
    AUCTION_RESCHEDULED(AuctionRescheduledMetadata.class),
    AUCTION_VOIDED(AuctionStatusMetadata.class),
    PRICE_DROPPED(PriceDroppedMetadata.class);

    private final Class<? extends EventMetadata> metadataType;

    EventType(Class<? extends EventMetadata> metadataType) {
        this.metadataType = metadataType;
    }

    public Class<? extends EventMetadata> getMetadataType() {
        return metadataType;
    }

    public boolean accepts(EventMetadata metadata) {
        return metadata != null && metadataType.isInstance(metadata);
    }
}

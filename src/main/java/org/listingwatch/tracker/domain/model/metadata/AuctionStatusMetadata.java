package org.listingwatch.tracker.domain.model.metadata;

import lombok.Value;
import org.listingwatch.tracker.domain.model.enums.ListingStatus;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata of AUCTION_CANCELLED and AUCTION_VOIDED events.
 */
@Value
public class AuctionStatusMetadata implements EventMetadata {

    ListingStatus previousStatus;
    OffsetDateTime auctionDatetime;
    String notes;

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("previous_status", previousStatus != null ? previousStatus.name() : null);
        map.put("auction_datetime", auctionDatetime != null ? auctionDatetime.toString() : null);
        map.put("notes", notes);
        return map;
    }
}

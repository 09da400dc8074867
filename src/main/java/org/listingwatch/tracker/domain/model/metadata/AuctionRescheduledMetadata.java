package org.listingwatch.tracker.domain.model.metadata;

import lombok.Value;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata of an AUCTION_RESCHEDULED event.
 */
@Value
public class AuctionRescheduledMetadata implements EventMetadata {

    OffsetDateTime oldAuctionDatetime;
    OffsetDateTime newAuctionDatetime;
    String notes;

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("old_auction_datetime", oldAuctionDatetime.toString());
        map.put("new_auction_datetime", newAuctionDatetime.toString());
        map.put("notes", notes);
        return map;
    }
}

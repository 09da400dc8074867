package org.listingwatch.tracker.domain.model.metadata;

import lombok.Value;
import org.listingwatch.tracker.api.exception.InvalidStateException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata of a PRICE_DROPPED event.
 */
@Value
public class PriceDroppedMetadata implements EventMetadata {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BigDecimal oldPrice;
    BigDecimal newPrice;
    BigDecimal dropAmount;
    BigDecimal dropPercent;

    /**
     * Compute drop amount and percent (two decimals, half-up) of {@code oldPrice}.
     *
     * @throws InvalidStateException if {@code oldPrice} is zero
     */
    public static PriceDroppedMetadata of(String listingId, BigDecimal oldPrice, BigDecimal newPrice) {
        if (oldPrice.signum() == 0) {
            throw new InvalidStateException(listingId,
                    "Cannot compute drop percent against a zero base price");
        }
        BigDecimal drop = oldPrice.subtract(newPrice);
        BigDecimal percent = drop.multiply(HUNDRED).divide(oldPrice, 2, RoundingMode.HALF_UP);
        return new PriceDroppedMetadata(oldPrice, newPrice, drop, percent);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("old_price", oldPrice);
        map.put("new_price", newPrice);
        map.put("drop_amount", dropAmount);
        map.put("drop_percent", dropPercent);
        return map;
    }
}

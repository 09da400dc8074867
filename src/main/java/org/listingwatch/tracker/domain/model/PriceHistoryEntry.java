package org.listingwatch.tracker.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One recorded price of a listing. Never modified once appended.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PriceHistoryEntry {

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal price;

    @Column(name = "observed_at", nullable = false)
    private OffsetDateTime observedAt;
}

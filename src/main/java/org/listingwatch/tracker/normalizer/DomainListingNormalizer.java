package org.listingwatch.tracker.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.domain.model.Address;
import org.listingwatch.tracker.domain.model.enums.ListingStatus;
import org.listingwatch.tracker.domain.model.enums.PropertyType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Set;

import static org.listingwatch.tracker.normalizer.JsonFields.*;

/**
 * Normalizes domain.com.au scraper payloads. Address parts are flat top-level keys,
 * the price lives under {@code priceDetails} and the auction under {@code auctionSchedule}.
 */
@Component
@Slf4j
public class DomainListingNormalizer extends AbstractSourceNormalizer {

    public static final String NAMESPACE = "domain";

    public DomainListingNormalizer(@Value("${listings.normalizer.default-zone:Australia/Melbourne}") ZoneId zone) {
        super(NAMESPACE, zone);
    }

    @Override
    public Set<String> sourceIds() {
        return Set.of(NAMESPACE, "domain.com.au");
    }

    @Override
    public CanonicalSnapshot normalize(String sourceId, JsonNode raw) {
        String listingId = qualifiedListingId(sourceId, text(raw, "listingId"));

        Address address = Address.builder()
                .unitNumber(text(raw, "unitNumber"))
                .streetNumber(text(raw, "streetNumber"))
                .streetName(text(raw, "street"))
                .suburb(requireAddressPart(sourceId, "suburb", text(raw, "suburb")))
                .state(requireAddressPart(sourceId, "state", text(raw, "state")))
                .postcode(requireAddressPart(sourceId, "postcode", text(raw, "postcode")))
                .fullAddress(text(raw, "displayAddress"))
                .latitude(coordinate(raw, "geoLocation", "latitude"))
                .longitude(coordinate(raw, "geoLocation", "longitude"))
                .build();

        BigDecimal price = price(raw, "priceDetails", "price");
        if (price == null) {
            price = price(raw, "priceDetails", "displayPrice");
        }

        OffsetDateTime auctionDatetime = dateTime(raw, zone, "auctionSchedule", "openingDateTime");
        String auctionStatus = text(raw, "auctionSchedule", "status");
        ListingStatus status = ListingStatus.fromString(auctionStatus != null ? auctionStatus : text(raw, "status"));
        if (status == ListingStatus.UNKNOWN && auctionStatus == null && auctionDatetime != null) {
            status = ListingStatus.SCHEDULED;
        }

        CanonicalSnapshot snapshot = CanonicalSnapshot.builder()
                .sourceId(sourceId)
                .listingId(listingId)
                .address(address)
                .propertyType(PropertyType.fromString(text(raw, "propertyType")))
                .bedrooms(integer(raw, "beds"))
                .bathrooms(integer(raw, "baths"))
                .landSize(decimal(raw, "landArea"))
                .buildingSize(decimal(raw, "buildingArea"))
                .price(price)
                .status(status)
                .auctionDatetime(auctionDatetime)
                .auctionNotes(text(raw, "auctionSchedule", "notes"))
                .propertyLink(text(raw, "listingUrl"))
                .description(joinedText(raw, "description"))
                .observedAt(dateTime(raw, zone, "scrapedAt"))
                .build();

        log.debug("Normalized domain listing {}: status={}, price={}", listingId, status, price);
        return snapshot;
    }
}

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
 * Normalizes realestate.com.au scraper payloads. The address is nested under {@code address}
 * (display strings under {@code address.display}), features under {@code generalFeatures} and
 * sizes under {@code propertySizes}.
 */
@Component
@Slf4j
public class RealestateListingNormalizer extends AbstractSourceNormalizer {

    public static final String NAMESPACE = "realestate";

    public RealestateListingNormalizer(@Value("${listings.normalizer.default-zone:Australia/Melbourne}") ZoneId zone) {
        super(NAMESPACE, zone);
    }

    @Override
    public Set<String> sourceIds() {
        return Set.of(NAMESPACE, "realestate.com.au");
    }

    @Override
    public CanonicalSnapshot normalize(String sourceId, JsonNode raw) {
        String listingId = qualifiedListingId(sourceId, text(raw, "id"));

        JsonNode address = at(raw, "address");
        JsonNode display = at(address, "display");
        Address canonicalAddress = Address.builder()
                .suburb(requireAddressPart(sourceId, "suburb", text(address, "suburb")))
                .state(requireAddressPart(sourceId, "state", text(address, "state")))
                .postcode(requireAddressPart(sourceId, "postcode", text(address, "postcode")))
                .fullAddress(text(display, "fullAddress"))
                .shortAddress(text(display, "shortAddress"))
                .latitude(coordinate(display, "geocode", "latitude"))
                .longitude(coordinate(display, "geocode", "longitude"))
                .build();

        BigDecimal price = price(raw, "price", "value");
        if (price == null) {
            price = price(raw, "price", "display");
        }

        JsonNode auction = at(raw, "auction");
        OffsetDateTime auctionDatetime = dateTime(auction, zone, "dateTime", "value");
        String auctionStatus = text(auction, "status");
        String listingStatus = text(raw, "status", "label") != null ? text(raw, "status", "label") : text(raw, "status");
        ListingStatus status = ListingStatus.fromString(auctionStatus != null ? auctionStatus : listingStatus);
        if (status == ListingStatus.UNKNOWN && auctionStatus == null && auction.isObject()) {
            status = ListingStatus.SCHEDULED;
        }

        CanonicalSnapshot snapshot = CanonicalSnapshot.builder()
                .sourceId(sourceId)
                .listingId(listingId)
                .address(canonicalAddress)
                .propertyType(PropertyType.fromString(text(raw, "propertyType")))
                .bedrooms(integer(raw, "generalFeatures", "bedrooms", "value"))
                .bathrooms(integer(raw, "generalFeatures", "bathrooms", "value"))
                .landSize(decimal(raw, "propertySizes", "land", "displayValue"))
                .buildingSize(decimal(raw, "propertySizes", "building", "displayValue"))
                .price(price)
                .status(status)
                .auctionDatetime(auctionDatetime)
                .auctionNotes(text(auction, "notes"))
                .propertyLink(text(raw, "propertyLink"))
                .description(joinedText(raw, "description"))
                .observedAt(dateTime(raw, zone, "scrapedAt"))
                .build();

        log.debug("Normalized realestate listing {}: status={}, price={}", listingId, status, price);
        return snapshot;
    }
}

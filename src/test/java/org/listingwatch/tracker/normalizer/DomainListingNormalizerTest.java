package org.listingwatch.tracker.normalizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.listingwatch.tracker.api.exception.NormalizationException;
import org.listingwatch.tracker.domain.model.enums.ListingStatus;
import org.listingwatch.tracker.domain.model.enums.PropertyType;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class DomainListingNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DomainListingNormalizer normalizer =
            new DomainListingNormalizer(ZoneId.of("Australia/Melbourne"));

    @Test
    void shouldNormalizeFullPayload() {
        CanonicalSnapshot snapshot = normalizer.normalize("domain", fullPayload());

        assertEquals("domain", snapshot.getSourceId());
        assertEquals("domain:2019512345", snapshot.getListingId());
        assertEquals("4", snapshot.getAddress().getUnitNumber());
        assertEquals("12", snapshot.getAddress().getStreetNumber());
        assertEquals("Smith Street", snapshot.getAddress().getStreetName());
        assertEquals("Richmond", snapshot.getAddress().getSuburb());
        assertEquals("VIC", snapshot.getAddress().getState());
        assertEquals("3121", snapshot.getAddress().getPostcode());
        assertEquals(-37.8183, snapshot.getAddress().getLatitude());
        assertEquals(PropertyType.TOWNHOUSE, snapshot.getPropertyType());
        assertEquals(3, snapshot.getBedrooms());
        assertEquals(2, snapshot.getBathrooms());
        assertEquals(0, new BigDecimal("800000").compareTo(snapshot.getPrice()));
        assertEquals(ListingStatus.SCHEDULED, snapshot.getStatus());
        assertEquals(OffsetDateTime.parse("2024-12-20T10:00:00+11:00"), snapshot.getAuctionDatetime());
        assertEquals("On site", snapshot.getAuctionNotes());
        assertEquals("Renovated. Walk to trains.", snapshot.getDescription());
        assertEquals(OffsetDateTime.parse("2024-11-01T08:30:00+11:00"), snapshot.getObservedAt());
    }

    @Test
    void shouldFallBackToDisplayPrice() {
        ObjectNode payload = fullPayload();
        ((ObjectNode) payload.get("priceDetails")).remove("price");
        ((ObjectNode) payload.get("priceDetails")).put("displayPrice", "$1.2m");

        assertEquals(0, new BigDecimal("1200000").compareTo(normalizer.normalize("domain", payload).getPrice()));
    }

    @Test
    void shouldTreatAuctionWithoutStatusAsScheduled() {
        ObjectNode payload = fullPayload();
        ((ObjectNode) payload.get("auctionSchedule")).remove("status");
        payload.remove("status");

        assertEquals(ListingStatus.SCHEDULED, normalizer.normalize("domain", payload).getStatus());
    }

    @Test
    void shouldTolerateMissingOptionalFields() {
        ObjectNode payload = mapper.createObjectNode()
                .put("listingId", "77")
                .put("suburb", "Carlton")
                .put("state", "VIC")
                .put("postcode", "3053");

        CanonicalSnapshot snapshot = normalizer.normalize("domain", payload);

        assertEquals("domain:77", snapshot.getListingId());
        assertNull(snapshot.getPrice());
        assertNull(snapshot.getBedrooms());
        assertEquals(PropertyType.OTHER, snapshot.getPropertyType());
        assertEquals(ListingStatus.UNKNOWN, snapshot.getStatus());
        assertNull(snapshot.getObservedAt());
    }

    @Test
    void shouldKeepAlreadyQualifiedListingId() {
        ObjectNode payload = fullPayload().put("listingId", "RealEstate:149785064");

        assertEquals("realestate:149785064", normalizer.normalize("domain", payload).getListingId());
    }

    @Test
    void shouldRejectMissingListingId() {
        ObjectNode payload = fullPayload();
        payload.remove("listingId");

        NormalizationException ex = assertThrows(NormalizationException.class,
                () -> normalizer.normalize("domain", payload));
        assertEquals("listingId", ex.getField());
        assertEquals("domain", ex.getSource());
    }

    @Test
    void shouldRejectMissingPostcode() {
        ObjectNode payload = fullPayload().put("postcode", " ");

        NormalizationException ex = assertThrows(NormalizationException.class,
                () -> normalizer.normalize("domain", payload));
        assertEquals("postcode", ex.getField());
    }

    private ObjectNode fullPayload() {
        ObjectNode payload = mapper.createObjectNode()
                .put("listingId", 2019512345L)
                .put("unitNumber", "4")
                .put("streetNumber", "12")
                .put("street", "Smith Street")
                .put("suburb", "Richmond")
                .put("state", "VIC")
                .put("postcode", "3121")
                .put("displayAddress", "4/12 Smith Street, Richmond VIC 3121")
                .put("propertyType", "Townhouse")
                .put("beds", 3)
                .put("baths", 2)
                .put("landArea", 210)
                .put("status", "live")
                .put("listingUrl", "https://www.domain.com.au/4-12-smith-street-richmond-vic-3121-2019512345")
                .put("scrapedAt", "2024-11-01T08:30:00");
        payload.putObject("geoLocation").put("latitude", -37.8183).put("longitude", 144.9984);
        payload.putObject("priceDetails").put("price", 800000).put("displayPrice", "$800,000");
        payload.putObject("auctionSchedule")
                .put("openingDateTime", "2024-12-20T10:00:00")
                .put("status", "Scheduled")
                .put("notes", "On site");
        payload.putArray("description").add("Renovated.").add("Walk to trains.");
        return payload;
    }
}

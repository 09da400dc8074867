package org.listingwatch.tracker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.listingwatch.tracker.domain.model.Address;
import org.listingwatch.tracker.normalizer.CanonicalSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SHA-256 over the mutable content of a normalized snapshot.
 * <p>
 * The observation time and the reporting source are left out, so the same listing content
 * seen later or through another source yields the same fingerprint. Decimals are compared by
 * value ({@code 750000} and {@code 750000.00} agree) and date-times by instant.
 */
@Component
@RequiredArgsConstructor
public class SnapshotFingerprinter {

    private final ObjectMapper objectMapper;

    public String fingerprint(CanonicalSnapshot snapshot) {
        try {
            byte[] canonical = objectMapper.writeValueAsBytes(canonicalFields(snapshot));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot fingerprint snapshot for " + snapshot.getListingId(), e);
        }
    }

    private static Map<String, Object> canonicalFields(CanonicalSnapshot s) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("listing_id", s.getListingId());
        Address a = s.getAddress();
        fields.put("street_number", a.getStreetNumber());
        fields.put("street_name", a.getStreetName());
        fields.put("unit_number", a.getUnitNumber());
        fields.put("suburb", a.getSuburb());
        fields.put("state", a.getState());
        fields.put("postcode", a.getPostcode());
        fields.put("full_address", a.getFullAddress());
        fields.put("short_address", a.getShortAddress());
        fields.put("latitude", a.getLatitude());
        fields.put("longitude", a.getLongitude());
        fields.put("property_type", s.getPropertyType() != null ? s.getPropertyType().name() : null);
        fields.put("bedrooms", s.getBedrooms());
        fields.put("bathrooms", s.getBathrooms());
        fields.put("land_size", plain(s.getLandSize()));
        fields.put("building_size", plain(s.getBuildingSize()));
        fields.put("price", plain(s.getPrice()));
        fields.put("status", s.getStatus() != null ? s.getStatus().name() : null);
        fields.put("auction_datetime", instant(s.getAuctionDatetime()));
        fields.put("auction_notes", s.getAuctionNotes());
        fields.put("property_link", s.getPropertyLink());
        fields.put("description", s.getDescription());
        return fields;
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }

    private static String instant(OffsetDateTime value) {
        return value == null ? null : value.toInstant().toString();
    }
}

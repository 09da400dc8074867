package org.listingwatch.tracker.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Property address. Immutable; a listing's address is replaced as a whole on re-ingestion.
 */
@Embeddable
@Getter
@Builder
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Address {

    @Column(name = "address_street_number")
    private String streetNumber;

    @Column(name = "address_street_name")
    private String streetName;

    @Column(name = "address_unit_number")
    private String unitNumber;

    @Column(name = "address_suburb", nullable = false)
    private String suburb;

    @Column(name = "address_state", nullable = false)
    private String state;

    @Column(name = "address_postcode", nullable = false)
    private String postcode;

    @Column(name = "address_full")
    private String fullAddress;

    @Column(name = "address_short")
    private String shortAddress;

    @Column(name = "address_latitude")
    private Double latitude;

    @Column(name = "address_longitude")
    private Double longitude;
}

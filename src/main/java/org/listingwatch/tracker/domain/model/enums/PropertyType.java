package org.listingwatch.tracker.domain.model.enums;

import java.util.Locale;

/**
 * Type of property. Unrecognized source strings map to {@link #OTHER}.
 */
public enum PropertyType {
    HOUSE,
    UNIT,
    TOWNHOUSE,
    LAND,
    OTHER;

    /**
     * Map a free-form source string to the closest property type.
     */
    public static PropertyType fromString(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String v = value.toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ').trim();

        // townhouse before house, "town house" contains "house"
        if (v.contains("townhouse") || v.contains("town house") || v.contains("terrace")) {
            return TOWNHOUSE;
        }
        if (v.contains("house") || v.contains("duplex")) {
            return HOUSE;
        }
        if (v.contains("unit") || v.contains("apartment") || v.contains("flat")
                || v.contains("studio") || v.contains("villa")) {
            return UNIT;
        }
        if (v.contains("land")) {
            return LAND;
        }
        return OTHER;
    }
}

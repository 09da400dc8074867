package org.listingwatch.tracker.domain.model.enums;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Listing status. {@link #UNKNOWN} is the default for missing or unrecognized source values.
 */
public enum ListingStatus {
    SCHEDULED,
    CANCELLED,
    VOIDED,
    SOLD,
    WITHDRAWN,
    ACTIVE,
    UNDER_OFFER,
    UNKNOWN;

    // an unsold or passed-in property stays on the market
    private static final Pattern NOT_SOLD = Pattern.compile("\\b(unsold|not sold|passed in)\\b");
    private static final Pattern SOLD_WORD = Pattern.compile("\\bsold\\b");

    /**
     * Map a free-form source status to a listing status, never failing.
     */
    public static ListingStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String v = value.toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ').trim();

        if (v.contains("cancel")) {
            return CANCELLED;
        }
        if (v.contains("void")) {
            return VOIDED;
        }
        if (v.contains("withdrawn")) {
            return WITHDRAWN;
        }
        if (v.contains("under offer") || v.contains("under contract")) {
            return UNDER_OFFER;
        }
        if (NOT_SOLD.matcher(v).find()) {
            return ACTIVE;
        }
        if (SOLD_WORD.matcher(v).find()) {
            return SOLD;
        }
        if (v.contains("schedul") || v.equals("auction")) {
            return SCHEDULED;
        }
        if (v.equals("active") || v.equals("buy") || v.equals("current")
                || v.equals("listed") || v.contains("for sale")) {
            return ACTIVE;
        }
        return UNKNOWN;
    }
}

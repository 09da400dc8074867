package org.listingwatch.tracker.normalizer;

import org.listingwatch.tracker.api.exception.NormalizationException;

import java.time.ZoneId;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity rules shared by all source normalizers: the namespace-qualified listing id and
 * the suburb/state/postcode triple are the only required fields.
 */
abstract class AbstractSourceNormalizer implements SourceNormalizer {

    private static final Pattern QUALIFIED_ID = Pattern.compile("^[a-z][a-z0-9.-]*:.+$", Pattern.CASE_INSENSITIVE);

    private final String namespace;
    protected final ZoneId zone;

    protected AbstractSourceNormalizer(String namespace, ZoneId zone) {
        this.namespace = namespace;
        this.zone = zone;
    }

    /**
     * Listing id qualified with this source's namespace, e.g. {@code realestate:149785064}.
     * An id that already carries a namespace is kept, so sources can reference each other's listings.
     */
    protected String qualifiedListingId(String sourceId, String rawId) {
        if (rawId == null || rawId.isBlank()) {
            throw new NormalizationException(sourceId, "listingId", "Snapshot has no listing id");
        }
        String id = rawId.trim();
        if (QUALIFIED_ID.matcher(id).matches()) {
            int colon = id.indexOf(':');
            return id.substring(0, colon).toLowerCase(Locale.ROOT) + id.substring(colon);
        }
        return namespace + ":" + id;
    }

    protected String requireAddressPart(String sourceId, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new NormalizationException(sourceId, field, "Snapshot address has no " + field);
        }
        return value.trim();
    }
}

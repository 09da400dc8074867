package org.listingwatch.tracker.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import org.listingwatch.tracker.api.exception.NormalizationException;

import java.util.Set;

/**
 * Maps one upstream source's raw JSON onto a {@link CanonicalSnapshot}.
 * Implementations are pure: no storage, history or timeline access.
 */
public interface SourceNormalizer {

    /**
     * Source identifiers this normalizer handles (lower case).
     */
    Set<String> sourceIds();

    /**
     * @throws NormalizationException if the listing id or the suburb/state/postcode is missing
     */
    CanonicalSnapshot normalize(String sourceId, JsonNode raw);
}

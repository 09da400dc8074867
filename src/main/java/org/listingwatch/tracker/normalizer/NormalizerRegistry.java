package org.listingwatch.tracker.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.listingwatch.tracker.api.exception.NormalizationException;
import org.listingwatch.tracker.api.exception.UnknownSourceException;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Routes raw snapshots to the normalizer registered for their source.
 * Adding a source means adding a {@link SourceNormalizer} bean.
 */
@Component
@Slf4j
public class NormalizerRegistry {

    private final Map<String, SourceNormalizer> normalizers = new HashMap<>();

    public NormalizerRegistry(List<SourceNormalizer> sourceNormalizers) {
        for (SourceNormalizer normalizer : sourceNormalizers) {
            for (String sourceId : normalizer.sourceIds()) {
                SourceNormalizer previous = normalizers.put(sourceId.toLowerCase(Locale.ROOT), normalizer);
                if (previous != null) {
                    throw new IllegalStateException("Source '" + sourceId + "' is claimed by both "
                            + previous.getClass().getSimpleName() + " and " + normalizer.getClass().getSimpleName());
                }
            }
        }
        log.info("Registered snapshot sources: {}", new TreeSet<>(normalizers.keySet()));
    }

    /**
     * @throws UnknownSourceException if no normalizer handles {@code sourceId}
     * @throws NormalizationException if the payload lacks identity fields
     */
    public CanonicalSnapshot normalize(String sourceId, JsonNode raw) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new UnknownSourceException(sourceId);
        }
        SourceNormalizer normalizer = normalizers.get(sourceId.trim().toLowerCase(Locale.ROOT));
        if (normalizer == null) {
            throw new UnknownSourceException(sourceId);
        }
        if (raw == null || !raw.isObject()) {
            throw new NormalizationException(sourceId, "payload", "Snapshot payload must be a JSON object");
        }
        return normalizer.normalize(sourceId.trim().toLowerCase(Locale.ROOT), raw);
    }

    public Set<String> supportedSources() {
        return Collections.unmodifiableSet(normalizers.keySet());
    }
}

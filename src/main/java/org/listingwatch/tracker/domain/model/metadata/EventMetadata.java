package org.listingwatch.tracker.domain.model.metadata;

import java.util.Map;

/**
 * Typed payload of a listing event. Each {@link org.listingwatch.tracker.domain.model.enums.EventType}
 * accepts exactly one implementation; {@link #toMap()} gives the persisted/serialized form.
 */
public interface EventMetadata {

    /**
     * Metadata as an ordered map with snake_case keys. Null values are kept.
     */
    Map<String, Object> toMap();
}

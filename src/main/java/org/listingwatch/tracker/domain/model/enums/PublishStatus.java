package org.listingwatch.tracker.domain.model.enums;

/**
 * Kafka publish status of a stored listing event (outbox columns).
 */
public enum PublishStatus {
    PENDING,
    PUBLISHED,
    FAILED
}

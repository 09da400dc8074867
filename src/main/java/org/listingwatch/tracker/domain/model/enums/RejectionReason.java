package org.listingwatch.tracker.domain.model.enums;

/**
 * Reason a snapshot was rejected and dead-lettered.
 */
public enum RejectionReason {
    UNKNOWN_SOURCE,
    MISSING_IDENTITY,
    INVALID_STATE,
    CONFLICT
}

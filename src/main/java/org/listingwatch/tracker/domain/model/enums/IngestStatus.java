package org.listingwatch.tracker.domain.model.enums;

/**
 * Outcome of a single snapshot ingestion.
 */
public enum IngestStatus {
    ACCEPTED,
    UNCHANGED,
    REJECTED
}

package org.listingwatch.tracker.domain.model.enums;

/**
 * Stage at which snapshot processing failed.
 */
public enum FailureStage {
    NORMALIZATION,
    AGGREGATE,
    PERSISTENCE
}

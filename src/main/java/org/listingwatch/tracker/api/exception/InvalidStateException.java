package org.listingwatch.tracker.api.exception;

import lombok.Getter;

/**
 * Thrown when applying a snapshot would violate a listing invariant.
 */
@Getter
public class InvalidStateException extends RuntimeException {

    private final String listingId;

    public InvalidStateException(String listingId, String message) {
        super(message + " (listing " + listingId + ")");
        this.listingId = listingId;
    }
}

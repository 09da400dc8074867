package org.listingwatch.tracker.api.exception;

import lombok.Getter;

/**
 * Thrown when a listing write cannot be applied because of a concurrent writer
 * or because the per-listing lock could not be acquired in time.
 */
@Getter
public class ConflictException extends RuntimeException {

    private final String listingId;

    public ConflictException(String listingId, String message) {
        super(message + " (listing " + listingId + ")");
        this.listingId = listingId;
    }

    public ConflictException(String listingId, String message, Throwable cause) {
        super(message + " (listing " + listingId + ")", cause);
        this.listingId = listingId;
    }
}

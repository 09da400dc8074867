package org.listingwatch.tracker.api.exception;

import lombok.Getter;

/**
 * Exception thrown when no normalizer is registered for a snapshot source.
 */
@Getter
public class UnknownSourceException extends RuntimeException {

    private final String source;

    public UnknownSourceException(String source) {
        super("Unknown snapshot source: " + source);
        this.source = source;
    }
}

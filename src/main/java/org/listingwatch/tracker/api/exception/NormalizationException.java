package org.listingwatch.tracker.api.exception;

import lombok.Getter;

/**
 * Thrown when a snapshot lacks a field required for listing identity.
 * The snapshot is rejected as a whole.
 */
@Getter
public class NormalizationException extends RuntimeException {

    private final String source;
    private final String field;

    public NormalizationException(String source, String field, String message) {
        super(message);
        this.source = source;
        this.field = field;
    }
}

package org.listingwatch.tracker.api.exception;

import lombok.Getter;
import org.listingwatch.tracker.api.dto.ListingEventMessage;

/**
 * Exception thrown when a listing event cannot be written to Kafka.
 */
@Getter
public class EventPublishException extends RuntimeException {

    private final transient ListingEventMessage event;

    public EventPublishException(ListingEventMessage event, Throwable cause) {
        super("Failed to publish event " + event.getId() + " for listing " + event.getListingId(), cause);
        this.event = event;
    }
}

package io.rthub.domain.common;

import io.rthub.domain.event.EventStatus;

/**
 * Operation not allowed from the event's current status.
 */
public class InvalidStateException extends EventHubException {

    private final String eventId;
    private final EventStatus currentStatus;

    public InvalidStateException(String eventId, EventStatus currentStatus, String message) {
        super(409, message);
        this.eventId = eventId;
        this.currentStatus = currentStatus;
    }

    public String getEventId() {
        return eventId;
    }

    public EventStatus getCurrentStatus() {
        return currentStatus;
    }
}

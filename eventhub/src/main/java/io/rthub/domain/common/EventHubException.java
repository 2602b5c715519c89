package io.rthub.domain.common;

/**
 * Base of every failure the event hub reports to a synchronous caller.
 * Carries the HTTP status the transport layer answers with.
 */
public class EventHubException extends RuntimeException {

    private final int statusCode;

    public EventHubException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public EventHubException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Message safe to show to API callers.
     */
    public String getPublicMessage() {
        return getMessage();
    }
}

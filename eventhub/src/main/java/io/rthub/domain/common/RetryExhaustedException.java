package io.rthub.domain.common;

public class RetryExhaustedException extends EventHubException {

    private final String eventId;
    private final int maxAttempts;

    public RetryExhaustedException(String eventId, int maxAttempts) {
        super(409, String.format("maximum retry attempts (%d) exceeded", maxAttempts));
        this.eventId = eventId;
        this.maxAttempts = maxAttempts;
    }

    public String getEventId() {
        return eventId;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}

package io.rthub.domain.common;

/**
 * Missing, malformed or oversized input.
 */
public class ValidationException extends EventHubException {

    public ValidationException(String message) {
        super(400, message);
    }
}

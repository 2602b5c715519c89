package io.rthub.domain.common;

/**
 * Persistence failure. The cause is logged where it happens; callers only see a generic message.
 */
public class StorageException extends EventHubException {

    public StorageException(String message, Throwable cause) {
        super(500, message, cause);
    }

    @Override
    public String getPublicMessage() {
        return "internal storage error";
    }
}

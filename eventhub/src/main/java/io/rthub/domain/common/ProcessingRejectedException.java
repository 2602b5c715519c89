package io.rthub.domain.common;

/**
 * The processing queue is full and cannot accept another scheduled task.
 */
public class ProcessingRejectedException extends EventHubException {

    public ProcessingRejectedException(String message) {
        super(503, message);
    }
}

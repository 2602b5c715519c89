package io.rthub.service.processing;

import io.rthub.domain.event.RtEvent;

/**
 * Business logic applied to each event by the processing workers.
 * A thrown exception marks the event failed with the exception's message.
 */
@FunctionalInterface
public interface EventProcessor {
    void process(RtEvent event) throws Exception;
}

package io.rthub.service.processing;

import io.rthub.domain.event.RtEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Default processor: logs the event and waits a fixed time standing in for real work.
 */
public final class DelayingEventProcessor implements EventProcessor {
    private static final Logger log = LoggerFactory.getLogger(DelayingEventProcessor.class);

    private final Duration delay;

    public DelayingEventProcessor(Duration delay) {
        this.delay = delay;
    }

    @Override
    public void process(RtEvent event) throws InterruptedException {
        log.debug("[PIPELINE] Processing event {} of type {}", event.id(), event.type());
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}

package io.rthub.service.core;

import io.rthub.config.PipelineConfig;
import io.rthub.domain.common.InvalidStateException;
import io.rthub.domain.common.NotFoundException;
import io.rthub.domain.common.ProcessingRejectedException;
import io.rthub.domain.common.RetryExhaustedException;
import io.rthub.domain.common.ValidationException;
import io.rthub.domain.event.EventDraft;
import io.rthub.domain.event.EventPage;
import io.rthub.domain.event.EventPriority;
import io.rthub.domain.event.EventStatus;
import io.rthub.domain.event.ListEventParams;
import io.rthub.domain.event.RetryParams;
import io.rthub.domain.event.RetryResult;
import io.rthub.domain.event.RtEvent;
import io.rthub.infrastructure.metrics.HubMetrics;
import io.rthub.repository.EventCursor;
import io.rthub.repository.EventRepository;
import io.rthub.service.processing.EventProcessor;
import io.rthub.service.processing.ProcessingQueue;
import io.rthub.service.processing.ProcessingTask;
import io.rthub.transport.ws.HubMessage;
import io.rthub.transport.ws.WsHub;
import io.rthub.util.Ids;
import io.rthub.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event pipeline.
 * Reliability rule: persist event first (repository/DB), then push to WS, then queue processing.
 *
 * Status machine: pending -> processed | failed; failed -> retry -> processed | failed.
 * Work in flight is tracked in memory only; an event is processed by at most one task at a time.
 */
public final class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    public static final String UNKNOWN_SOURCE = "unknown";
    public static final int DEFAULT_FAILED_LIMIT = 50;
    public static final int MAX_FAILED_LIMIT = 200;
    public static final int DEFAULT_PROCESS_LIMIT = 10;
    public static final int MAX_PROCESS_LIMIT = 50;

    private final EventRepository repo;
    private final WsHub wsHub;
    private final EventProcessor processor;
    private final ProcessingQueue queue;
    private final PipelineConfig config;
    private final HubMetrics metrics;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public EventService(EventRepository repo, WsHub wsHub, EventProcessor processor, ProcessingQueue queue,
                        PipelineConfig config, HubMetrics metrics, Clock clock) {
        this.repo = repo;
        this.wsHub = wsHub;
        this.processor = processor;
        this.queue = queue;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Starts the processing workers.
     */
    public void start() {
        queue.start(this::handleTask);
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    /**
     * Persist, broadcast and queue one event.
     *
     * @param sourceHeader X-Source header value, used when the draft names no source
     * @return the stored event, still pending
     */
    public RtEvent publish(EventDraft draft, String sourceHeader) {
        RtEvent event = toEvent(draft, sourceHeader, "event type is required");
        RtEvent persisted = repo.insert(event);
        afterPersist(persisted);
        log.debug("[PIPELINE] Published event {} (type={}, source={})",
                persisted.id(), persisted.type(), persisted.source());
        return persisted;
    }

    /**
     * All drafts are validated before any is stored; the batch is stored in one transaction.
     */
    public List<RtEvent> publishBatch(List<EventDraft> drafts, String sourceHeader) {
        if (drafts == null || drafts.isEmpty()) {
            throw new ValidationException("at least one event is required");
        }
        if (drafts.size() > config.maxBatchSize()) {
            throw new ValidationException(String.format("maximum %d events per batch", config.maxBatchSize()));
        }

        List<RtEvent> events = new ArrayList<>(drafts.size());
        for (EventDraft draft : drafts) {
            events.add(toEvent(draft, sourceHeader, "event type is required for all events"));
        }

        List<RtEvent> persisted = repo.insertAll(events);
        persisted.forEach(this::afterPersist);
        log.info("[PIPELINE] Published batch of {} events", persisted.size());
        return persisted;
    }

    private RtEvent toEvent(EventDraft draft, String sourceHeader, String missingTypeMessage) {
        if (draft == null || draft.type() == null || draft.type().isBlank()) {
            throw new ValidationException(missingTypeMessage);
        }
        EventPriority priority = parsePriority(draft.priority()).orElse(EventPriority.NORMAL);
        String source = firstNonBlank(draft.source(), sourceHeader);
        return RtEvent.pending(Ids.newId(), draft.type().trim(), source, draft.payload(), priority, now());
    }

    private void afterPersist(RtEvent event) {
        metrics.recordPublished(event.source());
        broadcast(event);
        if (queue.submit(event.id()).isEmpty()) {
            metrics.recordRejected("process");
            log.warn("[PIPELINE] Processing queue full, event {} stays pending", event.id());
        }
    }

    private void broadcast(RtEvent event) {
        try {
            wsHub.broadcastToAll(HubMessage.of(HubMessage.EVENT, Json.MAPPER.valueToTree(event)));
        } catch (RuntimeException e) {
            log.error("[PIPELINE] Failed to broadcast event {}: {}", event.id(), e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // PROCESSING
    // ═══════════════════════════════════════════════════════════════

    private void handleTask(ProcessingTask task) {
        log.debug("[PIPELINE] Running {}", task);
        processEvent(task.eventId());
    }

    /**
     * Runs the processor for one event and writes the terminal status.
     * Never throws; failures end up on the event or in the log.
     *
     * @return the event after processing, or empty if it was skipped
     */
    Optional<RtEvent> processEvent(String eventId) {
        if (!inFlight.add(eventId)) {
            log.debug("[PIPELINE] Event {} already being processed, skipping", eventId);
            return Optional.empty();
        }
        try {
            Optional<RtEvent> current = repo.findById(eventId);
            if (current.isEmpty()) {
                log.warn("[PIPELINE] Event {} no longer exists, skipping", eventId);
                return Optional.empty();
            }
            RtEvent event = current.get();
            if (event.status() != EventStatus.PENDING && event.status() != EventStatus.RETRY) {
                log.debug("[PIPELINE] Event {} is {}, nothing to process", eventId, event.status().value());
                return Optional.empty();
            }

            long started = System.nanoTime();
            String error = null;
            try {
                processor.process(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[PIPELINE] Processing of event {} interrupted", eventId);
                return Optional.of(event);
            } catch (Exception e) {
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("[PIPELINE] Processing of event {} failed: {}", eventId, error);
            }
            metrics.recordProcessed(error == null, Duration.ofNanos(System.nanoTime() - started));

            Optional<RtEvent> updated = error == null
                    ? repo.updateStatus(eventId, EventStatus.PROCESSED, null, now())
                    : repo.updateStatus(eventId, EventStatus.FAILED, error, null);
            return updated.or(() -> Optional.of(event));
        } catch (RuntimeException e) {
            log.error("[PIPELINE] Could not record processing result for event {}: {}", eventId, e.getMessage(), e);
            return Optional.empty();
        } finally {
            inFlight.remove(eventId);
        }
    }

    /**
     * Synchronously processes up to {@code limit} pending events, oldest first.
     *
     * @return the events as they stand afterwards
     */
    public List<RtEvent> processPendingEvents(int limit) {
        int effective = clamp(limit, DEFAULT_PROCESS_LIMIT, MAX_PROCESS_LIMIT);
        List<RtEvent> pending = repo.findByStatus(EventStatus.PENDING, effective, true);
        List<RtEvent> results = new ArrayList<>(pending.size());
        for (RtEvent event : pending) {
            results.add(processEvent(event.id()).orElse(event));
        }
        log.info("[PIPELINE] Processed {} pending event(s)", results.size());
        return results;
    }

    // ═══════════════════════════════════════════════════════════════
    // RETRY
    // ═══════════════════════════════════════════════════════════════

    /**
     * Schedules one delayed reprocessing of a failed event.
     *
     * @throws NotFoundException          unknown event
     * @throws InvalidStateException      event is neither failed nor retry
     * @throws RetryExhaustedException    retry budget used up
     * @throws ProcessingRejectedException the queue is full; the event is failed again
     */
    public RetryResult retryEvent(String eventId, RetryParams params) {
        RetryParams p = params != null ? params : RetryParams.none();
        RtEvent event = repo.findById(eventId).orElseThrow(() -> new NotFoundException("event", eventId));

        RetryParams.RetryOptions options = p.retryOptions();
        int maxAttempts = options != null && options.maxAttempts() != null && options.maxAttempts() > 0
                ? options.maxAttempts() : config.maxRetryAttempts();
        checkRetryable(event, maxAttempts);
        Duration delay = options != null && options.delaySeconds() != null && options.delaySeconds() > 0
                ? Duration.ofSeconds(options.delaySeconds()) : config.retryDelay();
        EventPriority priority = parsePriority(p.priority()).orElse(null);

        // status and budget are re-checked by the store in the same write
        RtEvent marked = repo.markForRetry(eventId, priority, maxAttempts).orElseThrow(() -> {
            RtEvent current = repo.findById(eventId).orElseThrow(() -> new NotFoundException("event", eventId));
            checkRetryable(current, maxAttempts);
            return new InvalidStateException(eventId, current.status(), "event changed concurrently, cannot retry");
        });
        Instant scheduledAt = now().plus(delay);

        Optional<ProcessingTask> task = queue.schedule(eventId, scheduledAt, ProcessingTask.Kind.RETRY);
        if (task.isEmpty()) {
            metrics.recordRejected("retry");
            repo.updateStatus(eventId, EventStatus.FAILED, "retry queue is full", null);
            throw new ProcessingRejectedException("retry queue is full");
        }

        metrics.recordRetryScheduled();
        log.info("[PIPELINE] Retry {} scheduled for event {} at {} (attempt {}/{}, reason={})",
                task.get().taskId(), eventId, scheduledAt, marked.retryCount(), maxAttempts,
                p.reason() != null ? p.reason() : "-");
        return new RetryResult(task.get().taskId(), eventId, scheduledAt, marked.retryCount());
    }

    private static void checkRetryable(RtEvent event, int maxAttempts) {
        if (!event.status().isRetryable()) {
            throw new InvalidStateException(event.id(), event.status(),
                    String.format("event status is %s, cannot retry", event.status().value()));
        }
        if (event.retryCount() >= maxAttempts) {
            throw new RetryExhaustedException(event.id(), maxAttempts);
        }
    }

    /**
     * Cancels a scheduled retry that has not started. The event goes back to failed;
     * the attempt stays counted.
     */
    public RtEvent cancelRetry(String retryId) {
        ProcessingTask task = queue.cancel(retryId, ProcessingTask.Kind.RETRY)
                .orElseThrow(() -> new NotFoundException("retry", retryId));
        RtEvent event = repo.updateStatus(task.eventId(), EventStatus.FAILED, null, null)
                .orElseThrow(() -> new NotFoundException("event", task.eventId()));
        log.info("[PIPELINE] Retry {} for event {} cancelled", retryId, task.eventId());
        return event;
    }

    /**
     * Failed events, oldest first.
     */
    public List<RtEvent> getFailedEvents(int limit) {
        int effective = limit >= 1 && limit <= MAX_FAILED_LIMIT ? limit : DEFAULT_FAILED_LIMIT;
        return repo.findByStatus(EventStatus.FAILED, effective, true);
    }

    // ═══════════════════════════════════════════════════════════════
    // CRUD
    // ═══════════════════════════════════════════════════════════════

    public RtEvent updateEventStatus(String eventId, String status, String errorMessage) {
        EventStatus parsed = EventStatus.parse(status).orElseThrow(() -> new ValidationException(
                "invalid status. Valid values: " + EventStatus.validValues()));
        Instant processedAt = parsed == EventStatus.PROCESSED ? now() : null;
        String error = errorMessage != null && !errorMessage.isBlank() ? errorMessage : null;
        RtEvent updated = repo.updateStatus(eventId, parsed, error, processedAt)
                .orElseThrow(() -> new NotFoundException("event", eventId));
        log.info("[PIPELINE] Event {} status set to {}", eventId, parsed.value());
        return updated;
    }

    public RtEvent get(String eventId) {
        return repo.findById(eventId).orElseThrow(() -> new NotFoundException("event", eventId));
    }

    /**
     * Cursor page, newest first in both directions.
     */
    public EventPage list(ListEventParams params) {
        int limit = clamp(params.limit(), ListEventParams.DEFAULT_LIMIT, ListEventParams.MAX_LIMIT);
        boolean hasCursor = params.cursor() != null && !params.cursor().isBlank();

        List<RtEvent> rows = new ArrayList<>(repo.list(params.withCursorAndLimit(params.cursor(), limit + 1)));
        boolean more = rows.size() > limit;
        if (more) {
            rows = new ArrayList<>(rows.subList(0, limit));
        }
        if (params.isBackward()) {
            Collections.reverse(rows);
        }
        long total = repo.count(params);

        boolean hasNext = params.isBackward() ? hasCursor : more;
        boolean hasPrev = params.isBackward() ? more : hasCursor;
        String next = hasNext && !rows.isEmpty() ? EventCursor.of(rows.get(rows.size() - 1)).encode() : null;
        String prev = hasPrev && !rows.isEmpty() ? EventCursor.of(rows.get(0)).encode() : null;
        return new EventPage(List.copyOf(rows), total, next, prev, hasNext, hasPrev);
    }

    public void delete(String eventId) {
        if (!repo.delete(eventId)) {
            throw new NotFoundException("event", eventId);
        }
        log.info("[PIPELINE] Event {} deleted", eventId);
    }

    /**
     * @return number of events removed; unknown ids are ignored
     */
    public int deleteBatch(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new ValidationException("at least one id is required");
        }
        int removed = repo.deleteAll(ids);
        log.info("[PIPELINE] Deleted {} of {} requested events", removed, ids.size());
        return removed;
    }

    public int queueDepth() {
        return queue.depth();
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static Optional<EventPriority> parsePriority(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(EventPriority.parse(raw).orElseThrow(() -> new ValidationException(
                "invalid priority. Valid values: " + EventPriority.validValues())));
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : UNKNOWN_SOURCE;
    }

    static int clamp(int requested, int defaultValue, int max) {
        if (requested <= 0) {
            return defaultValue;
        }
        return Math.min(requested, max);
    }
}

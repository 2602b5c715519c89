package io.rthub.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.prometheus.client.CollectorRegistry;
import io.rthub.config.HubConfig;
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
import io.rthub.repository.InMemoryEventRepository;
import io.rthub.service.processing.ProcessingQueue;
import io.rthub.support.TestClock;
import io.rthub.transport.ws.FakeConnection;
import io.rthub.transport.ws.WsHub;
import io.rthub.util.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Pipeline behaviour with an in-memory store and a live hub. Workers are not started,
 * so processing is driven explicitly through processEvent / processPendingEvents.
 */
class EventServiceTest {

    private TestClock clock;
    private CollectorRegistry registry;
    private InMemoryEventRepository repo;
    private WsHub hub;
    private ProcessingQueue queue;
    private EventService service;

    private final AtomicReference<Exception> failWith = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        clock = TestClock.at("2025-03-01T10:00:00Z");
        registry = new CollectorRegistry();
        repo = new InMemoryEventRepository();
        service = newService(100);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown(Duration.ofSeconds(1));
        hub.shutdown();
    }

    private EventService newService(int queueCapacity) {
        HubMetrics metrics = new HubMetrics(registry);
        hub = new WsHub(HubConfig.defaults(), metrics, clock);
        queue = new ProcessingQueue(queueCapacity, 1, clock);
        return new EventService(repo, hub, event -> {
            Exception e = failWith.get();
            if (e != null) {
                throw e;
            }
        }, queue, PipelineConfig.defaults(), metrics, clock);
    }

    private EventService replaceService(int queueCapacity) {
        queue.shutdown(Duration.ofSeconds(1));
        hub.shutdown();
        registry = new CollectorRegistry();
        service = newService(queueCapacity);
        return service;
    }

    private RtEvent publish(String type) {
        RtEvent event = service.publish(EventDraft.of(type, "web"), null);
        clock.advance(Duration.ofSeconds(1));
        return event;
    }

    private RtEvent failed(String type) {
        RtEvent event = publish(type);
        failWith.set(new IllegalStateException("downstream unavailable"));
        service.processEvent(event.id());
        failWith.set(null);
        return service.get(event.id());
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    @Test
    void publishStoresPendingEventWithDefaults() {
        RtEvent event = service.publish(new EventDraft("order.created", null, null, null), "checkout");

        assertThat(event.status()).isEqualTo(EventStatus.PENDING);
        assertThat(event.priority()).isEqualTo(EventPriority.NORMAL);
        assertThat(event.source()).isEqualTo("checkout");
        assertThat(event.retryCount()).isZero();
        assertThat(event.id()).hasSize(21);
        assertThat(repo.findById(event.id())).contains(event);
        assertThat(service.queueDepth()).isEqualTo(1);
        assertThat(registry.getSampleValue("rthub_events_published_total",
                new String[]{"source"}, new String[]{"checkout"})).isEqualTo(1.0);
    }

    @Test
    void draftSourceWinsOverHeaderAndUnknownIsFallback() {
        RtEvent fromDraft = service.publish(EventDraft.of("a", "billing"), "checkout");
        RtEvent fromNothing = service.publish(EventDraft.of("a", " "), null);

        assertThat(fromDraft.source()).isEqualTo("billing");
        assertThat(fromNothing.source()).isEqualTo(EventService.UNKNOWN_SOURCE);
    }

    @Test
    void publishBroadcastsEventFrameToConnectedClients() {
        FakeConnection client = new FakeConnection("client");
        hub.openSession("u1", client);

        RtEvent event = service.publish(EventDraft.of("order.created", "web"), null);

        await().atMost(Duration.ofSeconds(5)).until(() -> client.framesOfType("event").size() == 1);
        JsonNode data = client.framesOfType("event").get(0).path("data");
        assertThat(data.path("id").asText()).isEqualTo(event.id());
        assertThat(data.path("status").asText()).isEqualTo("pending");
    }

    @Test
    void publishRejectsBlankTypeAndUnknownPriority() {
        assertThatThrownBy(() -> service.publish(EventDraft.of("  ", "web"), null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("event type is required");
        assertThatThrownBy(() -> service.publish(new EventDraft("a", "web", null, "asap"), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("invalid priority");

        assertThat(repo.countAll()).isZero();
        assertThat(service.queueDepth()).isZero();
    }

    @Test
    void publishWithFullQueueLeavesEventPending() {
        replaceService(1);

        RtEvent first = service.publish(EventDraft.of("a", "web"), null);
        RtEvent second = service.publish(EventDraft.of("b", "web"), null);

        assertThat(service.queueDepth()).isEqualTo(1);
        assertThat(service.get(second.id()).status()).isEqualTo(EventStatus.PENDING);
        assertThat(registry.getSampleValue("rthub_tasks_rejected_total",
                new String[]{"kind"}, new String[]{"process"})).isEqualTo(1.0);

        List<RtEvent> processed = service.processPendingEvents(10);
        assertThat(processed).extracting(RtEvent::id).containsExactly(first.id(), second.id());
        assertThat(processed).allMatch(e -> e.status() == EventStatus.PROCESSED);
    }

    @Test
    void batchOfMaximumSizeIsAccepted() {
        List<EventDraft> drafts = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            drafts.add(EventDraft.of("bulk", null));
        }

        List<RtEvent> stored = service.publishBatch(drafts, "importer");

        assertThat(stored).hasSize(100);
        assertThat(stored).allMatch(e -> e.source().equals("importer") && e.status() == EventStatus.PENDING);
        assertThat(repo.countAll()).isEqualTo(100);
        assertThat(service.queueDepth()).isEqualTo(100);
    }

    @Test
    void batchBeyondLimitOrEmptyIsRejected() {
        List<EventDraft> drafts = new ArrayList<>();
        for (int i = 0; i < 101; i++) {
            drafts.add(EventDraft.of("bulk", null));
        }

        assertThatThrownBy(() -> service.publishBatch(drafts, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("maximum 100 events per batch");
        assertThatThrownBy(() -> service.publishBatch(List.of(), null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("at least one event is required");
        assertThat(repo.countAll()).isZero();
    }

    @Test
    void batchWithOneInvalidItemStoresNothing() {
        List<EventDraft> drafts = List.of(EventDraft.of("a", null), EventDraft.of("", null), EventDraft.of("c", null));

        assertThatThrownBy(() -> service.publishBatch(drafts, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("event type is required for all events");
        assertThat(repo.countAll()).isZero();
        assertThat(service.queueDepth()).isZero();
    }

    // ═══════════════════════════════════════════════════════════════
    // PROCESSING
    // ═══════════════════════════════════════════════════════════════

    @Test
    void successfulProcessingMarksEventProcessed() {
        RtEvent event = publish("a");

        Optional<RtEvent> result = service.processEvent(event.id());

        assertThat(result).isPresent();
        assertThat(result.get().status()).isEqualTo(EventStatus.PROCESSED);
        assertThat(result.get().processedAt()).isEqualTo(clock.instant());
        assertThat(result.get().errorMessage()).isNull();
    }

    @Test
    void failedProcessingRecordsErrorMessage() {
        RtEvent event = failed("a");

        assertThat(event.status()).isEqualTo(EventStatus.FAILED);
        assertThat(event.errorMessage()).isEqualTo("downstream unavailable");
        assertThat(event.processedAt()).isNull();
    }

    @Test
    void processingSkipsMissingAndTerminalEvents() {
        RtEvent event = publish("a");
        service.processEvent(event.id());

        assertThat(service.processEvent(event.id())).isEmpty();
        assertThat(service.processEvent("does-not-exist")).isEmpty();
    }

    @Test
    void eventIsProcessedByOneClaimantAtATime() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        HubMetrics metrics = new HubMetrics(new CollectorRegistry());
        EventService blocking = new EventService(repo, hub, e -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
        }, queue, PipelineConfig.defaults(), metrics, clock);
        RtEvent event = publish("a");

        CompletableFuture<Optional<RtEvent>> first = CompletableFuture.supplyAsync(() -> blocking.processEvent(event.id()));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(blocking.processEvent(event.id())).isEmpty();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).hasValueSatisfying(
                e -> assertThat(e.status()).isEqualTo(EventStatus.PROCESSED));
    }

    @Test
    void processPendingEventsRunsOldestFirstUpToLimit() {
        RtEvent a = publish("a");
        RtEvent b = publish("b");
        publish("c");

        List<RtEvent> results = service.processPendingEvents(2);

        assertThat(results).extracting(RtEvent::id).containsExactly(a.id(), b.id());
        assertThat(repo.findByStatus(EventStatus.PENDING, 10, true)).hasSize(1);
    }

    @Test
    void concurrentPendingSweepsProcessEachEventOnce() throws Exception {
        Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();
        EventService counting = new EventService(repo, hub, e -> {
            runs.computeIfAbsent(e.id(), id -> new AtomicInteger()).incrementAndGet();
            Thread.sleep(5);
        }, queue, PipelineConfig.defaults(), new HubMetrics(new CollectorRegistry()), clock);
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(publish("sweep-" + i).id());
        }

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<RtEvent>>> sweeps = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                sweeps.add(pool.submit(() -> {
                    start.await();
                    return counting.processPendingEvents(10);
                }));
            }
            start.countDown();
            for (Future<List<RtEvent>> sweep : sweeps) {
                sweep.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (String id : ids) {
            assertThat(repo.findById(id)).hasValueSatisfying(
                    e -> assertThat(e.status()).isEqualTo(EventStatus.PROCESSED));
            assertThat(runs.get(id)).hasValue(1);
        }
        assertThat(runs).hasSize(5);
    }

    // ═══════════════════════════════════════════════════════════════
    // RETRY
    // ═══════════════════════════════════════════════════════════════

    @Test
    void retryOfFailedEventSchedulesDelayedTask() {
        RtEvent event = failed("a");
        int depthBefore = service.queueDepth();

        RetryResult result = service.retryEvent(event.id(), RetryParams.none());

        assertThat(result.eventId()).isEqualTo(event.id());
        assertThat(result.attempt()).isEqualTo(1);
        assertThat(result.scheduledAt()).isEqualTo(clock.instant().plusSeconds(60));
        assertThat(service.queueDepth()).isEqualTo(depthBefore + 1);
        RtEvent stored = service.get(event.id());
        assertThat(stored.status()).isEqualTo(EventStatus.RETRY);
        assertThat(stored.retryCount()).isEqualTo(1);
    }

    @Test
    void retryOptionsOverrideDelayBudgetAndPriority() {
        RtEvent event = failed("a");

        RetryResult result = service.retryEvent(event.id(),
                new RetryParams("manual", "urgent", new RetryParams.RetryOptions(5, 10)));

        assertThat(result.scheduledAt()).isEqualTo(clock.instant().plusSeconds(10));
        assertThat(service.get(event.id()).priority()).isEqualTo(EventPriority.URGENT);
    }

    @Test
    void retryRejectsUnknownIdAndWrongStatus() {
        RtEvent pending = publish("a");

        assertThatThrownBy(() -> service.retryEvent("missing", RetryParams.none()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.retryEvent(pending.id(), RetryParams.none()))
                .isInstanceOf(InvalidStateException.class)
                .hasMessage("event status is pending, cannot retry");
        assertThat(service.get(pending.id()).retryCount()).isZero();
    }

    @Test
    void retryIsRejectedOnceBudgetIsUsed() {
        RtEvent event = failed("a");
        failWith.set(new IllegalStateException("still down"));
        for (int attempt = 1; attempt <= 3; attempt++) {
            service.retryEvent(event.id(), RetryParams.none());
            service.processEvent(event.id());
        }

        RtEvent exhausted = service.get(event.id());
        assertThat(exhausted.status()).isEqualTo(EventStatus.FAILED);
        assertThat(exhausted.retryCount()).isEqualTo(3);
        assertThatThrownBy(() -> service.retryEvent(event.id(), RetryParams.none()))
                .isInstanceOf(RetryExhaustedException.class)
                .hasMessage("maximum retry attempts (3) exceeded");
        assertThat(service.get(event.id()).retryCount()).isEqualTo(3);

        RetryResult raisedBudget = service.retryEvent(event.id(), RetryParams.withOptions(4, null));
        assertThat(raisedBudget.attempt()).isEqualTo(4);
    }

    @Test
    void concurrentRetriesNeverExceedBudget() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            for (int round = 0; round < 20; round++) {
                RtEvent event = failed("race-" + round);
                repo.markForRetry(event.id(), null, 3);
                repo.markForRetry(event.id(), null, 3);
                repo.updateStatus(event.id(), EventStatus.FAILED, "still down", null);
                int depthBefore = service.queueDepth();

                CountDownLatch start = new CountDownLatch(1);
                List<Future<Boolean>> attempts = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    attempts.add(pool.submit(() -> {
                        start.await();
                        try {
                            service.retryEvent(event.id(), RetryParams.none());
                            return true;
                        } catch (RetryExhaustedException e) {
                            return false;
                        }
                    }));
                }
                start.countDown();

                int accepted = 0;
                for (Future<Boolean> attempt : attempts) {
                    if (attempt.get(10, TimeUnit.SECONDS)) {
                        accepted++;
                    }
                }
                assertThat(accepted).isEqualTo(1);
                assertThat(service.get(event.id()).retryCount()).isEqualTo(3);
                assertThat(service.queueDepth()).isEqualTo(depthBefore + 1);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void retryWithFullQueueFailsEventAgain() {
        replaceService(1);
        RtEvent event = service.publish(EventDraft.of("a", "web"), null);
        failWith.set(new IllegalStateException("boom"));
        service.processEvent(event.id());

        assertThatThrownBy(() -> service.retryEvent(event.id(), RetryParams.none()))
                .isInstanceOf(ProcessingRejectedException.class);

        RtEvent stored = service.get(event.id());
        assertThat(stored.status()).isEqualTo(EventStatus.FAILED);
        assertThat(stored.errorMessage()).isEqualTo("retry queue is full");
    }

    @Test
    void cancelledRetryReturnsEventToFailed() {
        RtEvent event = failed("a");
        RetryResult retry = service.retryEvent(event.id(), RetryParams.none());

        RtEvent cancelled = service.cancelRetry(retry.retryId());

        assertThat(cancelled.status()).isEqualTo(EventStatus.FAILED);
        assertThat(cancelled.retryCount()).isEqualTo(1);
        assertThatThrownBy(() -> service.cancelRetry(retry.retryId()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void failedEventsAreListedOldestFirst() {
        RtEvent first = failed("a");
        publish("ok");
        RtEvent second = failed("b");

        assertThat(service.getFailedEvents(0)).extracting(RtEvent::id).containsExactly(first.id(), second.id());
        assertThat(service.getFailedEvents(1)).extracting(RtEvent::id).containsExactly(first.id());
    }

    // ═══════════════════════════════════════════════════════════════
    // CRUD
    // ═══════════════════════════════════════════════════════════════

    @Test
    void updateStatusValidatesBeforeWriting() {
        RtEvent event = publish("a");

        assertThatThrownBy(() -> service.updateEventStatus(event.id(), "processing", null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("invalid status. Valid values: pending, processed, failed, retry");
        assertThatThrownBy(() -> service.updateEventStatus("missing", "failed", "x"))
                .isInstanceOf(NotFoundException.class);

        RtEvent updated = service.updateEventStatus(event.id(), "FAILED", "manual");
        assertThat(updated.status()).isEqualTo(EventStatus.FAILED);
        assertThat(updated.errorMessage()).isEqualTo("manual");
    }

    @Test
    void listPagesForwardAndBack() {
        List<RtEvent> events = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            events.add(publish("t" + i));
        }

        EventPage first = service.list(ListEventParams.firstPage(2));
        assertThat(first.items()).extracting(RtEvent::id).containsExactly(events.get(4).id(), events.get(3).id());
        assertThat(first.total()).isEqualTo(5);
        assertThat(first.hasNextPage()).isTrue();
        assertThat(first.hasPrevPage()).isFalse();

        EventPage second = service.list(new ListEventParams(null, null, null, first.nextCursor(), 2, null));
        assertThat(second.items()).extracting(RtEvent::id).containsExactly(events.get(2).id(), events.get(1).id());
        assertThat(second.hasPrevPage()).isTrue();

        EventPage back = service.list(new ListEventParams(null, null, null, second.prevCursor(), 3, "backward"));
        assertThat(back.items()).extracting(RtEvent::id).containsExactly(events.get(4).id(), events.get(3).id());
        assertThat(back.hasNextPage()).isTrue();
        assertThat(back.hasPrevPage()).isFalse();
    }

    @Test
    void deleteRemovesEventsAndReportsUnknownIds() {
        RtEvent a = publish("a");
        RtEvent b = publish("b");
        RtEvent c = publish("c");

        service.delete(a.id());
        assertThatThrownBy(() -> service.delete(a.id())).isInstanceOf(NotFoundException.class);

        assertThat(service.deleteBatch(List.of(b.id(), c.id(), "missing"))).isEqualTo(2);
        assertThatThrownBy(() -> service.deleteBatch(List.of())).isInstanceOf(ValidationException.class);
        assertThat(repo.countAll()).isZero();
    }

    @Test
    void eventsSerializeWithSnakeCaseFields() throws Exception {
        RtEvent event = failed("a");

        JsonNode json = Json.MAPPER.readTree(Json.MAPPER.writeValueAsString(event));

        assertThat(json.has("created_at")).isTrue();
        assertThat(json.path("error_message").asText()).isEqualTo("downstream unavailable");
        assertThat(json.path("retry_count").asInt()).isZero();
        assertThat(json.has("processed_at")).isFalse();
    }
}

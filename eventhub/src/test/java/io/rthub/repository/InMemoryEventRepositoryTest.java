package io.rthub.repository;

import io.rthub.domain.common.ValidationException;
import io.rthub.domain.event.EventPriority;
import io.rthub.domain.event.EventStatus;
import io.rthub.domain.event.ListEventParams;
import io.rthub.domain.event.RtEvent;
import io.rthub.domain.event.SearchQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private InMemoryEventRepository repo;

    @BeforeEach
    void setUp() {
        repo = new InMemoryEventRepository();
    }

    private RtEvent event(String id, String type, String source, int secondsAfterT0) {
        return RtEvent.pending(id, type, source, null, EventPriority.NORMAL, T0.plusSeconds(secondsAfterT0));
    }

    private void seed(int count) {
        for (int i = 0; i < count; i++) {
            repo.insert(event("e" + i, i % 2 == 0 ? "click" : "view", "web", i));
        }
    }

    private static List<String> ids(List<RtEvent> events) {
        return events.stream().map(RtEvent::id).toList();
    }

    @Test
    void forwardListIsNewestFirstAndContinuesAfterCursor() {
        seed(5);

        List<RtEvent> first = repo.list(ListEventParams.firstPage(2));
        assertEquals(List.of("e4", "e3"), ids(first));

        String cursor = EventCursor.of(first.get(1)).encode();
        List<RtEvent> second = repo.list(ListEventParams.firstPage(2).withCursorAndLimit(cursor, 2));
        assertEquals(List.of("e2", "e1"), ids(second));
    }

    @Test
    void backwardListIsOldestFirstAndNewerThanCursor() {
        seed(5);
        String cursor = EventCursor.of(repo.findById("e1").orElseThrow()).encode();

        ListEventParams params = new ListEventParams(null, null, null, cursor, 2, "backward");

        assertEquals(List.of("e2", "e3"), ids(repo.list(params)));
    }

    @Test
    void listAppliesFiltersAndCountIgnoresCursor() {
        seed(6);
        ListEventParams clicks = new ListEventParams("click", null, null, null, 10, null);

        assertEquals(List.of("e4", "e2", "e0"), ids(repo.list(clicks)));
        assertEquals(3, repo.count(clicks.withCursorAndLimit(EventCursor.of(repo.findById("e4").orElseThrow()).encode(), 1)));
    }

    @Test
    void malformedCursorIsAValidationError() {
        seed(1);
        ListEventParams params = ListEventParams.firstPage(10).withCursorAndLimit("%%%", 10);

        assertThrows(ValidationException.class, () -> repo.list(params));
    }

    @Test
    void insertAllIsAllOrNothing() {
        repo.insert(event("dup", "click", "web", 0));

        assertThrows(IllegalStateException.class, () -> repo.insertAll(List.of(
                event("fresh", "click", "web", 1),
                event("dup", "click", "web", 2))));

        assertTrue(repo.findById("fresh").isEmpty());
        assertEquals(1, repo.countAll());
    }

    @Test
    void updateStatusFollowsStoreRules() {
        repo.insert(event("e1", "click", "web", 0));

        RtEvent failed = repo.updateStatus("e1", EventStatus.FAILED, "boom", null).orElseThrow();
        assertEquals("boom", failed.errorMessage());

        RtEvent retry = repo.updateStatus("e1", EventStatus.RETRY, null, null).orElseThrow();
        assertEquals("boom", retry.errorMessage(), "error kept when none is given");

        Instant done = T0.plusSeconds(5);
        RtEvent processed = repo.updateStatus("e1", EventStatus.PROCESSED, null, done).orElseThrow();
        assertEquals(done, processed.processedAt());
        assertNull(processed.errorMessage());

        assertTrue(repo.updateStatus("missing", EventStatus.FAILED, "x", null).isEmpty());
    }

    @Test
    void markForRetryIncrementsCountAndOptionallyChangesPriority() {
        repo.insert(event("e1", "click", "web", 0));
        repo.updateStatus("e1", EventStatus.FAILED, "x", null);

        RtEvent once = repo.markForRetry("e1", null, 3).orElseThrow();
        RtEvent twice = repo.markForRetry("e1", EventPriority.URGENT, 3).orElseThrow();

        assertEquals(1, once.retryCount());
        assertEquals(EventPriority.NORMAL, once.priority());
        assertEquals(2, twice.retryCount());
        assertEquals(EventStatus.RETRY, twice.status());
        assertEquals(EventPriority.URGENT, twice.priority());
    }

    @Test
    void markForRetryAppliesOnlyWithinBudgetAndFromRetryableStatus() {
        repo.insert(event("e1", "click", "web", 0));
        assertTrue(repo.markForRetry("e1", null, 3).isEmpty());
        assertTrue(repo.markForRetry("missing", null, 3).isEmpty());

        repo.updateStatus("e1", EventStatus.FAILED, "x", null);
        assertTrue(repo.markForRetry("e1", null, 2).isPresent());
        assertTrue(repo.markForRetry("e1", null, 2).isPresent());
        assertTrue(repo.markForRetry("e1", null, 2).isEmpty());

        RtEvent stored = repo.findById("e1").orElseThrow();
        assertEquals(2, stored.retryCount());
        assertEquals(EventStatus.RETRY, stored.status());
    }

    @Test
    void findByStatusHonoursOrderAndLimit() {
        seed(4);
        repo.updateStatus("e0", EventStatus.FAILED, "a", null);
        repo.updateStatus("e2", EventStatus.FAILED, "b", null);
        repo.updateStatus("e3", EventStatus.FAILED, "c", null);

        assertEquals(List.of("e0", "e2"), ids(repo.findByStatus(EventStatus.FAILED, 2, true)));
        assertEquals(List.of("e3", "e2", "e0"), ids(repo.findByStatus(EventStatus.FAILED, 10, false)));
    }

    @Test
    void searchFiltersByTimeRangeAndPages() {
        seed(10);
        SearchQuery query = new SearchQuery(null, Map.of("type", "click"),
                new SearchQuery.TimeRange(T0.plusSeconds(2), T0.plusSeconds(8)), null, 1, 2);

        assertEquals(List.of("e6", "e4"), ids(repo.search(query)));
        assertEquals(4, repo.countSearch(query));
    }

    @Test
    void countByGroupsOnWhitelistedFieldsOnly() {
        seed(5);

        assertEquals(Map.of("click", 3L, "view", 2L), repo.countBy("type"));
        assertEquals(List.of("pending"), repo.distinctValues("status"));
        assertThrows(ValidationException.class, () -> repo.countBy("payload"));
    }

    @Test
    void averageProcessingTimeCoversProcessedEventsOnly() {
        seed(3);
        repo.updateStatus("e0", EventStatus.PROCESSED, null, T0.plusMillis(100));
        repo.updateStatus("e1", EventStatus.PROCESSED, null, T0.plusSeconds(1).plusMillis(300));

        assertEquals(200.0, repo.averageProcessingMillis(T0), 0.001);
        assertEquals(0.0, repo.averageProcessingMillis(T0.plusSeconds(60)), 0.001);
    }

    @Test
    void deleteAllIgnoresUnknownIds() {
        seed(3);

        assertEquals(2, repo.deleteAll(List.of("e0", "e2", "nope")));
        assertEquals(1, repo.countAll());
        assertFalse(repo.delete("e0"));
    }
}

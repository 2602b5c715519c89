package io.rthub.repository;

import io.rthub.domain.common.ValidationException;
import io.rthub.domain.event.EventPriority;
import io.rthub.domain.event.EventStatus;
import io.rthub.domain.event.ListEventParams;
import io.rthub.domain.event.RtEvent;
import io.rthub.domain.event.SearchQuery;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process-local event store (STORE=memory). Not durable.
 * Every method holds the instance monitor, so each call is atomic.
 */
public final class InMemoryEventRepository implements EventRepository {

    private static final Comparator<RtEvent> OLDEST_FIRST =
            Comparator.comparing(RtEvent::createdAt).thenComparing(RtEvent::id);

    private final Map<String, RtEvent> events = new LinkedHashMap<>();

    @Override
    public synchronized RtEvent insert(RtEvent event) {
        if (events.containsKey(event.id())) {
            throw new IllegalStateException("duplicate event id " + event.id());
        }
        events.put(event.id(), event);
        return event;
    }

    @Override
    public synchronized List<RtEvent> insertAll(List<RtEvent> batch) {
        for (RtEvent e : batch) {
            if (events.containsKey(e.id())) {
                throw new IllegalStateException("duplicate event id " + e.id());
            }
        }
        batch.forEach(e -> events.put(e.id(), e));
        return List.copyOf(batch);
    }

    @Override
    public synchronized Optional<RtEvent> findById(String id) {
        return Optional.ofNullable(events.get(id));
    }

    @Override
    public synchronized boolean delete(String id) {
        return events.remove(id) != null;
    }

    @Override
    public synchronized int deleteAll(List<String> ids) {
        int removed = 0;
        for (String id : ids) {
            if (events.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized List<RtEvent> list(ListEventParams params) {
        Stream<RtEvent> stream = events.values().stream().filter(matches(params));
        if (params.cursor() != null && !params.cursor().isBlank()) {
            EventCursor cursor = EventCursor.decode(params.cursor());
            stream = params.isBackward()
                    ? stream.filter(e -> cursor.compareTo(e) < 0)
                    : stream.filter(e -> cursor.compareTo(e) > 0);
        }
        Comparator<RtEvent> order = params.isBackward() ? OLDEST_FIRST : OLDEST_FIRST.reversed();
        return stream.sorted(order).limit(Math.max(0, params.limit())).toList();
    }

    @Override
    public synchronized long count(ListEventParams params) {
        return events.values().stream().filter(matches(params)).count();
    }

    @Override
    public synchronized Optional<RtEvent> updateStatus(String id, EventStatus status, String errorMessage,
                                                       Instant processedAt) {
        RtEvent current = events.get(id);
        if (current == null) {
            return Optional.empty();
        }
        RtEvent updated = current.withStatus(status, errorMessage, processedAt);
        events.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized Optional<RtEvent> markForRetry(String id, EventPriority priority, int maxAttempts) {
        RtEvent current = events.get(id);
        if (current == null || !current.status().isRetryable() || current.retryCount() >= maxAttempts) {
            return Optional.empty();
        }
        RtEvent updated = current.withRetry(priority);
        events.put(id, updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized List<RtEvent> findByStatus(EventStatus status, int limit, boolean oldestFirst) {
        Comparator<RtEvent> order = oldestFirst ? OLDEST_FIRST : OLDEST_FIRST.reversed();
        return events.values().stream()
                .filter(e -> e.status() == status)
                .sorted(order)
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public synchronized List<RtEvent> search(SearchQuery query) {
        Stream<RtEvent> stream = events.values().stream()
                .filter(matches(query))
                .sorted(OLDEST_FIRST.reversed())
                .skip(Math.max(0, query.from()));
        if (query.size() > 0) {
            stream = stream.limit(query.size());
        }
        return stream.toList();
    }

    @Override
    public synchronized long countSearch(SearchQuery query) {
        return events.values().stream().filter(matches(query)).count();
    }

    @Override
    public synchronized Map<String, Long> countBy(String field) {
        Function<RtEvent, String> key = extractor(field);
        return events.values().stream()
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }

    @Override
    public synchronized List<String> distinctValues(String field) {
        return new ArrayList<>(countBy(field).keySet());
    }

    @Override
    public synchronized long countAll() {
        return events.size();
    }

    @Override
    public synchronized long countCreatedSince(Instant since) {
        return events.values().stream().filter(e -> !e.createdAt().isBefore(since)).count();
    }

    @Override
    public synchronized double averageProcessingMillis(Instant since) {
        return events.values().stream()
                .filter(e -> e.processedAt() != null && !e.processedAt().isBefore(since))
                .mapToLong(e -> Duration.between(e.createdAt(), e.processedAt()).toMillis())
                .average()
                .orElse(0.0);
    }

    private static Predicate<RtEvent> matches(ListEventParams p) {
        return e -> (p.type() == null || p.type().equals(e.type()))
                && (p.source() == null || p.source().equals(e.source()))
                && (p.status() == null || p.status() == e.status());
    }

    private static Predicate<RtEvent> matches(SearchQuery q) {
        String type = q.filter("type");
        String source = q.filter("source");
        String status = q.filter("status");
        String priority = q.filter("priority");
        SearchQuery.TimeRange range = q.timeRange();
        return e -> (type == null || type.equals(e.type()))
                && (source == null || source.equals(e.source()))
                && (status == null || status.equalsIgnoreCase(e.status().value()))
                && (priority == null || priority.equalsIgnoreCase(e.priority().value()))
                && (range == null || range.start() == null || !e.createdAt().isBefore(range.start()))
                && (range == null || range.end() == null || !e.createdAt().isAfter(range.end()));
    }

    private static Function<RtEvent, String> extractor(String field) {
        return switch (field) {
            case "type" -> RtEvent::type;
            case "source" -> RtEvent::source;
            case "status" -> e -> e.status().value();
            case "priority" -> e -> e.priority().value();
            default -> throw new ValidationException("cannot group by field: " + field);
        };
    }
}

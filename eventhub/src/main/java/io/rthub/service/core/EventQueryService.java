package io.rthub.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.rthub.domain.common.ValidationException;
import io.rthub.domain.event.EventPriority;
import io.rthub.domain.event.EventStatus;
import io.rthub.domain.event.ListEventParams;
import io.rthub.domain.event.RealtimeStats;
import io.rthub.domain.event.RtEvent;
import io.rthub.domain.event.SearchQuery;
import io.rthub.domain.event.SearchResult;
import io.rthub.domain.event.StatsParams;
import io.rthub.repository.EventRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only views over the event store: structured search, realtime stats and history.
 */
public final class EventQueryService {

    public static final String DEFAULT_INTERVAL = "5m";
    public static final String DEFAULT_STATS_TYPE = "overview";
    public static final int DEFAULT_HISTORY_LIMIT = 100;
    public static final int MAX_HISTORY_LIMIT = 1000;

    public static final Duration MAX_INTERVAL = Duration.ofDays(365);

    private static final Pattern INTERVAL = Pattern.compile("(\\d+)([smhd])");

    private final EventRepository repo;
    private final Clock clock;

    public EventQueryService(EventRepository repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    /**
     * Filters, optional time range and paging; terms aggregations are computed over the whole store.
     */
    public SearchResult search(SearchQuery query) {
        if (query == null) {
            query = new SearchQuery(null, null, null, null, 0, 0);
        }
        validateFilter(query.filter("status"), "status", EventStatus.parse(query.filter("status")).isPresent(),
                EventStatus.validValues());
        validateFilter(query.filter("priority"), "priority", EventPriority.parse(query.filter("priority")).isPresent(),
                EventPriority.validValues());

        int size = EventService.clamp(query.size(), SearchQuery.DEFAULT_SIZE, SearchQuery.MAX_SIZE);
        SearchQuery paged = query.withPaging(Math.max(0, query.from()), size);

        List<RtEvent> events = repo.search(paged);
        long total = repo.countSearch(paged);

        Map<String, Object> aggregations = null;
        if (query.aggregations() != null && !query.aggregations().isEmpty()) {
            aggregations = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> agg : query.aggregations().entrySet()) {
                aggregations.put(agg.getKey(), termsAggregation(agg.getKey(), agg.getValue()));
            }
        }
        return new SearchResult(total, events, aggregations);
    }

    private static void validateFilter(String raw, String name, boolean valid, String allowed) {
        if (raw != null && !valid) {
            throw new ValidationException("invalid " + name + " filter. Valid values: " + allowed);
        }
    }

    private Map<String, Object> termsAggregation(String name, JsonNode spec) {
        String field = spec == null ? "" : spec.path("terms").path("field").asText("");
        if (!EventRepository.GROUPABLE_FIELDS.contains(field)) {
            throw new ValidationException("aggregation " + name + ": terms field must be one of "
                    + String.join(", ", EventRepository.GROUPABLE_FIELDS));
        }
        List<Map<String, Object>> buckets = new ArrayList<>();
        repo.countBy(field).entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .forEach(e -> {
                    Map<String, Object> bucket = new LinkedHashMap<>();
                    bucket.put("key", e.getKey());
                    bucket.put("doc_count", e.getValue());
                    buckets.add(bucket);
                });
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("buckets", buckets);
        return result;
    }

    /**
     * Totals, rate over the interval, error rate and average processing time.
     */
    public RealtimeStats realtimeStats(StatsParams params) {
        String interval = params != null && params.interval() != null && !params.interval().isBlank()
                ? params.interval().trim() : DEFAULT_INTERVAL;
        String type = params != null && params.type() != null && !params.type().isBlank()
                ? params.type().trim() : DEFAULT_STATS_TYPE;
        Duration window = parseInterval(interval);
        Instant now = clock.instant();
        Instant since = now.minus(window);

        Map<String, Long> byStatus = repo.countBy("status");
        long total = repo.countAll();
        long failed = byStatus.getOrDefault(EventStatus.FAILED.value(), 0L);
        long recent = repo.countCreatedSince(since);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_events", total);
        metrics.put("events_in_interval", recent);
        metrics.put("events_per_second", (double) recent / window.toSeconds());
        metrics.put("error_rate", total > 0 ? (double) failed / total : 0.0);
        metrics.put("avg_processing_time_ms", repo.averageProcessingMillis(since));

        Map<String, Map<String, Long>> breakdown = new LinkedHashMap<>();
        breakdown.put("by_status", byStatus);
        breakdown.put("by_type", repo.countBy("type"));
        if (!DEFAULT_STATS_TYPE.equals(type)) {
            breakdown.put("by_source", repo.countBy("source"));
            breakdown.put("by_priority", repo.countBy("priority"));
        }
        return new RealtimeStats(now, interval, type, metrics, breakdown);
    }

    /**
     * Parses "30s", "5m", "1h" or "1d", up to {@link #MAX_INTERVAL}.
     */
    static Duration parseInterval(String raw) {
        Matcher m = INTERVAL.matcher(raw.toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new ValidationException("invalid interval: " + raw + " (expected e.g. 30s, 5m, 1h)");
        }
        long amount;
        try {
            amount = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw new ValidationException("invalid interval: " + raw);
        }
        if (amount <= 0) {
            throw new ValidationException("interval must be positive: " + raw);
        }
        Duration window;
        try {
            window = switch (m.group(2)) {
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            };
        } catch (ArithmeticException e) {
            throw new ValidationException("interval too large: " + raw);
        }
        if (window.compareTo(MAX_INTERVAL) > 0) {
            throw new ValidationException("interval must not exceed 365d: " + raw);
        }
        return window;
    }

    /**
     * Most recent events, optionally filtered by type and source.
     */
    public List<RtEvent> history(String type, String source, int limit) {
        int effective = EventService.clamp(limit, DEFAULT_HISTORY_LIMIT, MAX_HISTORY_LIMIT);
        return repo.list(new ListEventParams(blankToNull(type), blankToNull(source), null, null, effective, null));
    }

    public List<String> eventTypes() {
        return repo.distinctValues("type");
    }

    public List<String> eventSources() {
        return repo.distinctValues("source");
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}

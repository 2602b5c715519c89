package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * Structured event search. Supported filter keys: type, source, status, priority.
 * Aggregations use the form {"name": {"terms": {"field": "type"}}}.
 */
public record SearchQuery(
    @JsonProperty("query") String query,
    @JsonProperty("filters") Map<String, Object> filters,
    @JsonProperty("time_range") TimeRange timeRange,
    @JsonProperty("aggregations") Map<String, JsonNode> aggregations,
    @JsonProperty("from") int from,
    @JsonProperty("size") int size
) {
    public static final int DEFAULT_SIZE = 100;
    public static final int MAX_SIZE = 1000;

    public String filter(String key) {
        if (filters == null) {
            return null;
        }
        Object value = filters.get(key);
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    public SearchQuery withPaging(int newFrom, int newSize) {
        return new SearchQuery(query, filters, timeRange, aggregations, newFrom, newSize);
    }

    public record TimeRange(
        @JsonProperty("start") Instant start,
        @JsonProperty("end") Instant end
    ) {
    }
}

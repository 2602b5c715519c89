package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResult(
    @JsonProperty("total") long total,
    @JsonProperty("events") List<RtEvent> events,
    @JsonProperty("aggregations") Map<String, Object> aggregations
) {
}

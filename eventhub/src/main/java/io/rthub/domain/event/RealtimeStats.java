package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record RealtimeStats(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("interval") String interval,
    @JsonProperty("type") String type,
    @JsonProperty("metrics") Map<String, Object> metrics,
    @JsonProperty("breakdown") Map<String, Map<String, Long>> breakdown
) {
}

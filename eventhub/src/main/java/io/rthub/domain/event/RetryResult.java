package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record RetryResult(
    @JsonProperty("retry_id") String retryId,
    @JsonProperty("event_id") String eventId,
    @JsonProperty("scheduled_at") Instant scheduledAt,
    @JsonProperty("attempt") int attempt
) {
}

package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Application event tracked by the pipeline.
 * Serialized as-is on the HTTP API and inside hub "event" frames.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RtEvent(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("source") String source,
    @JsonProperty("payload") JsonNode payload,
    @JsonProperty("priority") EventPriority priority,
    @JsonProperty("status") EventStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("processed_at") Instant processedAt,   // null until processed
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("error_message") String errorMessage   // last processing error, if any
) {
    /**
     * A freshly published event: pending, never retried.
     */
    public static RtEvent pending(String id, String type, String source, JsonNode payload,
                                  EventPriority priority, Instant createdAt) {
        return new RtEvent(id, type, source, payload, priority, EventStatus.PENDING,
                           createdAt, null, 0, null);
    }

    /**
     * Status transition as the store applies it: PROCESSED stamps processedAt and clears
     * the error; other statuses keep the previous error unless a new one is given.
     */
    public RtEvent withStatus(EventStatus newStatus, String error, Instant now) {
        if (newStatus == EventStatus.PROCESSED) {
            return new RtEvent(id, type, source, payload, priority, newStatus, createdAt, now, retryCount, null);
        }
        String nextError = error != null ? error : errorMessage;
        return new RtEvent(id, type, source, payload, priority, newStatus, createdAt, processedAt, retryCount, nextError);
    }

    public RtEvent withRetry(EventPriority newPriority) {
        EventPriority p = newPriority != null ? newPriority : priority;
        return new RtEvent(id, type, source, payload, p, EventStatus.RETRY, createdAt, processedAt,
                           retryCount + 1, errorMessage);
    }
}

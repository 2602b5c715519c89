package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller-supplied fields of an event to publish. Priority stays a raw string
 * so that unknown values surface as validation errors rather than parse errors.
 */
public record EventDraft(
    @JsonProperty("type") String type,
    @JsonProperty("source") String source,
    @JsonProperty("payload") JsonNode payload,
    @JsonProperty("priority") String priority
) {
    public static EventDraft of(String type, String source) {
        return new EventDraft(type, source, null, null);
    }
}

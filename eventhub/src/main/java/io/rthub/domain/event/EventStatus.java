package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Persisted processing status of an event.
 *
 * <pre>
 * PENDING -> PROCESSED | FAILED
 * FAILED  -> RETRY -> PROCESSED | FAILED
 * </pre>
 * Work in flight is not persisted: a running event still reads PENDING or RETRY.
 */
public enum EventStatus {
    PENDING("pending"),
    PROCESSED("processed"),
    FAILED("failed"),
    RETRY("retry");

    private final String value;

    EventStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isRetryable() {
        return this == FAILED || this == RETRY;
    }

    public static Optional<EventStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(s -> s.value.equals(normalized)).findFirst();
    }

    @JsonCreator
    public static EventStatus fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("unknown event status: " + raw));
    }

    public static String validValues() {
        return "pending, processed, failed, retry";
    }
}

package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum EventPriority {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    URGENT("urgent");

    private final String value;

    EventPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<EventPriority> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.value.equals(normalized)).findFirst();
    }

    @JsonCreator
    public static EventPriority fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("unknown event priority: " + raw));
    }

    public static String validValues() {
        return "low, normal, high, urgent";
    }
}

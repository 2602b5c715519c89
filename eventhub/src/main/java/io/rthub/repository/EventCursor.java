package io.rthub.repository;

import io.rthub.domain.common.ValidationException;
import io.rthub.domain.event.RtEvent;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * Opaque keyset cursor: (created_at millis, id), base64url encoded.
 */
public record EventCursor(Instant createdAt, String id) {

    public static EventCursor of(RtEvent event) {
        return new EventCursor(event.createdAt(), event.id());
    }

    public String encode() {
        String raw = createdAt.toEpochMilli() + ":" + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static EventCursor decode(String cursor) {
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid cursor");
        }
        int sep = raw.indexOf(':');
        if (sep <= 0 || sep == raw.length() - 1) {
            throw new ValidationException("invalid cursor");
        }
        try {
            long millis = Long.parseLong(raw.substring(0, sep));
            return new EventCursor(Instant.ofEpochMilli(millis), raw.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new ValidationException("invalid cursor");
        }
    }

    /**
     * Keyset order: created_at, then id.
     */
    public int compareTo(RtEvent event) {
        int byTime = createdAt.compareTo(event.createdAt());
        return byTime != 0 ? byTime : id.compareTo(event.id());
    }
}

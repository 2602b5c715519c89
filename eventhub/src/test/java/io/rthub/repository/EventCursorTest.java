package io.rthub.repository;

import io.rthub.domain.common.ValidationException;
import io.rthub.domain.event.EventPriority;
import io.rthub.domain.event.RtEvent;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class EventCursorTest {

    @Test
    void decodesWhatItEncodes() {
        RtEvent e = RtEvent.pending("abc_-123", "t", "s", null, EventPriority.LOW,
                Instant.parse("2025-03-01T10:00:00.123Z"));

        EventCursor decoded = EventCursor.decode(EventCursor.of(e).encode());

        assertEquals(e.createdAt(), decoded.createdAt());
        assertEquals("abc_-123", decoded.id());
        assertEquals(0, decoded.compareTo(e));
    }

    @Test
    void ordersByTimeThenId() {
        Instant t = Instant.parse("2025-03-01T10:00:00Z");
        EventCursor cursor = new EventCursor(t, "m");

        assertTrue(cursor.compareTo(RtEvent.pending("a", "t", "s", null, EventPriority.LOW, t)) > 0);
        assertTrue(cursor.compareTo(RtEvent.pending("z", "t", "s", null, EventPriority.LOW, t)) < 0);
        assertTrue(cursor.compareTo(RtEvent.pending("a", "t", "s", null, EventPriority.LOW, t.plusMillis(1))) < 0);
    }

    @Test
    void rejectsGarbage() {
        String noSeparator = Base64.getUrlEncoder().encodeToString("12345".getBytes(StandardCharsets.UTF_8));
        String notANumber = Base64.getUrlEncoder().encodeToString("abc:id".getBytes(StandardCharsets.UTF_8));

        assertThrows(ValidationException.class, () -> EventCursor.decode("***"));
        assertThrows(ValidationException.class, () -> EventCursor.decode(noSeparator));
        assertThrows(ValidationException.class, () -> EventCursor.decode(notANumber));
    }
}

package io.rthub.domain.event;

/**
 * Filters and cursor window for listing events. Null filters match everything.
 *
 * @param direction "forward" (newest first, the default) or "backward"
 */
public record ListEventParams(
    String type,
    String source,
    EventStatus status,
    String cursor,
    int limit,
    String direction
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public boolean isBackward() {
        return "backward".equalsIgnoreCase(direction);
    }

    public ListEventParams withCursorAndLimit(String newCursor, int newLimit) {
        return new ListEventParams(type, source, status, newCursor, newLimit, direction);
    }

    public static ListEventParams firstPage(int limit) {
        return new ListEventParams(null, null, null, null, limit, null);
    }
}

package io.rthub.repository;

import io.rthub.domain.event.EventPriority;
import io.rthub.domain.event.EventStatus;
import io.rthub.domain.event.ListEventParams;
import io.rthub.domain.event.RtEvent;
import io.rthub.domain.event.SearchQuery;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Event store. Implementations throw {@link io.rthub.domain.common.StorageException}
 * on persistence failures.
 *
 * Status writes are plain last-write-wins updates; there is no compare-and-swap.
 */
public interface EventRepository {

    /** Fields that can be grouped on by {@link #countBy(String)} and {@link #distinctValues(String)}. */
    List<String> GROUPABLE_FIELDS = List.of("type", "source", "status", "priority");

    RtEvent insert(RtEvent event);

    /**
     * Insert all events or none.
     */
    List<RtEvent> insertAll(List<RtEvent> events);

    Optional<RtEvent> findById(String id);

    boolean delete(String id);

    /**
     * @return number of rows removed; unknown ids are ignored
     */
    int deleteAll(List<String> ids);

    /**
     * Filtered cursor window. Forward returns newest first and strictly older than the
     * cursor; backward returns oldest first and strictly newer than the cursor.
     * Returns at most {@code params.limit()} rows.
     */
    List<RtEvent> list(ListEventParams params);

    /**
     * Count of rows matching the filters of {@code params}; cursor and limit are ignored.
     */
    long count(ListEventParams params);

    /**
     * Set status. PROCESSED stamps {@code processedAt} and clears the error;
     * any other status keeps the existing error unless {@code errorMessage} is non-null.
     *
     * @return the updated event, or empty if the id is unknown
     */
    Optional<RtEvent> updateStatus(String id, EventStatus status, String errorMessage, Instant processedAt);

    /**
     * Increment retry_count and set status RETRY in one conditional write; priority is replaced
     * when non-null. Applies only while the event is failed or retry and retry_count is below
     * {@code maxAttempts}.
     *
     * @return the updated event, or empty if the id is unknown or the condition does not hold
     */
    Optional<RtEvent> markForRetry(String id, EventPriority priority, int maxAttempts);

    /**
     * @param oldestFirst true for FIFO order (failed events are retried oldest first)
     */
    List<RtEvent> findByStatus(EventStatus status, int limit, boolean oldestFirst);

    /**
     * Newest first, honouring filters, time range, from and size.
     */
    List<RtEvent> search(SearchQuery query);

    long countSearch(SearchQuery query);

    /**
     * @param field one of {@link #GROUPABLE_FIELDS}
     */
    Map<String, Long> countBy(String field);

    List<String> distinctValues(String field);

    long countAll();

    long countCreatedSince(Instant since);

    /**
     * Mean of (processedAt - createdAt) for events processed since {@code since}; 0 when none.
     */
    double averageProcessingMillis(Instant since);
}

package io.rthub.repository;

import com.fasterxml.jackson.databind.JsonNode;
import io.rthub.domain.common.StorageException;
import io.rthub.domain.common.ValidationException;
import io.rthub.domain.event.EventPriority;
import io.rthub.domain.event.EventStatus;
import io.rthub.domain.event.ListEventParams;
import io.rthub.domain.event.RtEvent;
import io.rthub.domain.event.SearchQuery;
import io.rthub.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of EventRepository over the rt_events table.
 */
public final class PostgresEventRepository implements EventRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEventRepository.class);

    private static final String COLUMNS = """
            id, type, source, payload, priority, status,
            created_at, processed_at, retry_count, error_message
            """;

    private final DataSource dataSource;

    public PostgresEventRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public RtEvent insert(RtEvent event) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(insertSql())) {
            bindInsert(ps, event);
            ps.executeUpdate();
            return event;
        } catch (Exception ex) {
            log.error("Failed to insert event {}: {}", event.id(), ex.getMessage(), ex);
            throw new StorageException("Failed to insert event", ex);
        }
    }

    @Override
    public List<RtEvent> insertAll(List<RtEvent> events) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(insertSql())) {
                for (RtEvent e : events) {
                    bindInsert(ps, e);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (Exception ex) {
                conn.rollback();
                throw ex;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            return List.copyOf(events);
        } catch (Exception ex) {
            log.error("Failed to insert batch of {} events: {}", events.size(), ex.getMessage(), ex);
            throw new StorageException("Failed to insert events", ex);
        }
    }

    @Override
    public Optional<RtEvent> findById(String id) {
        String sql = "SELECT " + COLUMNS + " FROM rt_events WHERE id = ?";
        List<RtEvent> rows = query(sql, List.of(id), "find event");
        return rows.stream().findFirst();
    }

    @Override
    public boolean delete(String id) {
        return update("DELETE FROM rt_events WHERE id = ?", List.of(id), "delete event") > 0;
    }

    @Override
    public int deleteAll(List<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = "DELETE FROM rt_events WHERE id = ANY (?)";
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setArray(1, conn.createArrayOf("varchar", ids.toArray()));
            return ps.executeUpdate();
        } catch (Exception ex) {
            log.error("Failed to delete {} events: {}", ids.size(), ex.getMessage(), ex);
            throw new StorageException("Failed to delete events", ex);
        }
    }

    @Override
    public List<RtEvent> list(ListEventParams params) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM rt_events WHERE 1=1");
        appendFilters(sql, args, params);
        boolean backward = params.isBackward();
        if (params.cursor() != null && !params.cursor().isBlank()) {
            EventCursor cursor = EventCursor.decode(params.cursor());
            sql.append(backward ? " AND (created_at, id) > (?, ?)" : " AND (created_at, id) < (?, ?)");
            args.add(Timestamp.from(cursor.createdAt()));
            args.add(cursor.id());
        }
        sql.append(backward ? " ORDER BY created_at ASC, id ASC" : " ORDER BY created_at DESC, id DESC");
        sql.append(" LIMIT ?");
        args.add(Math.max(0, params.limit()));
        return query(sql.toString(), args, "list events");
    }

    @Override
    public long count(ListEventParams params) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM rt_events WHERE 1=1");
        appendFilters(sql, args, params);
        return queryLong(sql.toString(), args, "count events");
    }

    @Override
    public Optional<RtEvent> updateStatus(String id, EventStatus status, String errorMessage, Instant processedAt) {
        String sql = """
                UPDATE rt_events
                SET status = ?,
                    processed_at = CASE WHEN ?::boolean THEN ?::timestamptz ELSE processed_at END,
                    error_message = CASE WHEN ?::boolean THEN NULL ELSE COALESCE(?::text, error_message) END
                WHERE id = ?
                RETURNING
                """ + COLUMNS;
        boolean processed = status == EventStatus.PROCESSED;
        List<Object> args = new ArrayList<>();
        args.add(status.value());
        args.add(processed);
        args.add(processedAt != null ? Timestamp.from(processedAt) : null);
        args.add(processed);
        args.add(errorMessage);
        args.add(id);
        return query(sql, args, "update event status").stream().findFirst();
    }

    @Override
    public Optional<RtEvent> markForRetry(String id, EventPriority priority, int maxAttempts) {
        String sql = """
                UPDATE rt_events
                SET status = 'retry',
                    retry_count = retry_count + 1,
                    priority = COALESCE(?::varchar, priority)
                WHERE id = ?
                  AND status IN ('failed', 'retry')
                  AND retry_count < ?
                RETURNING
                """ + COLUMNS;
        List<Object> args = new ArrayList<>();
        args.add(priority != null ? priority.value() : null);
        args.add(id);
        args.add(maxAttempts);
        return query(sql, args, "mark event for retry").stream().findFirst();
    }

    @Override
    public List<RtEvent> findByStatus(EventStatus status, int limit, boolean oldestFirst) {
        String order = oldestFirst ? "ASC" : "DESC";
        String sql = "SELECT " + COLUMNS + " FROM rt_events WHERE status = ?"
                + " ORDER BY created_at " + order + ", id " + order + " LIMIT ?";
        return query(sql, List.of(status.value(), Math.max(0, limit)), "find events by status");
    }

    @Override
    public List<RtEvent> search(SearchQuery query) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM rt_events WHERE 1=1");
        appendSearchFilters(sql, args, query);
        sql.append(" ORDER BY created_at DESC, id DESC");
        if (query.size() > 0) {
            sql.append(" LIMIT ?");
            args.add(query.size());
        }
        sql.append(" OFFSET ?");
        args.add(Math.max(0, query.from()));
        return query(sql.toString(), args, "search events");
    }

    @Override
    public long countSearch(SearchQuery query) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM rt_events WHERE 1=1");
        appendSearchFilters(sql, args, query);
        return queryLong(sql.toString(), args, "count search results");
    }

    @Override
    public Map<String, Long> countBy(String field) {
        String column = groupColumn(field);
        String sql = "SELECT " + column + ", COUNT(*) FROM rt_events GROUP BY " + column + " ORDER BY " + column;
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            Map<String, Long> counts = new LinkedHashMap<>();
            while (rs.next()) {
                counts.put(rs.getString(1), rs.getLong(2));
            }
            return counts;
        } catch (Exception ex) {
            log.error("Failed to count events by {}: {}", field, ex.getMessage(), ex);
            throw new StorageException("Failed to count events", ex);
        }
    }

    @Override
    public List<String> distinctValues(String field) {
        String column = groupColumn(field);
        String sql = "SELECT DISTINCT " + column + " FROM rt_events ORDER BY " + column;
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            List<String> values = new ArrayList<>();
            while (rs.next()) {
                values.add(rs.getString(1));
            }
            return values;
        } catch (Exception ex) {
            log.error("Failed to list distinct {}: {}", field, ex.getMessage(), ex);
            throw new StorageException("Failed to list distinct values", ex);
        }
    }

    @Override
    public long countAll() {
        return queryLong("SELECT COUNT(*) FROM rt_events", List.of(), "count events");
    }

    @Override
    public long countCreatedSince(Instant since) {
        return queryLong("SELECT COUNT(*) FROM rt_events WHERE created_at >= ?",
                List.of(Timestamp.from(since)), "count recent events");
    }

    @Override
    public double averageProcessingMillis(Instant since) {
        String sql = """
                SELECT COALESCE(AVG(EXTRACT(EPOCH FROM (processed_at - created_at)) * 1000), 0)
                FROM rt_events
                WHERE processed_at IS NOT NULL AND processed_at >= ?
                """;
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getDouble(1) : 0.0;
            }
        } catch (Exception ex) {
            log.error("Failed to compute average processing time: {}", ex.getMessage(), ex);
            throw new StorageException("Failed to compute processing time", ex);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private static String insertSql() {
        return "INSERT INTO rt_events (" + COLUMNS + ") VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)";
    }

    private static void bindInsert(PreparedStatement ps, RtEvent e) throws Exception {
        ps.setString(1, e.id());
        ps.setString(2, e.type());
        ps.setString(3, e.source());
        ps.setString(4, e.payload() != null ? Json.MAPPER.writeValueAsString(e.payload()) : null);
        ps.setString(5, e.priority().value());
        ps.setString(6, e.status().value());
        ps.setTimestamp(7, Timestamp.from(e.createdAt()));
        ps.setTimestamp(8, e.processedAt() != null ? Timestamp.from(e.processedAt()) : null);
        ps.setInt(9, e.retryCount());
        ps.setString(10, e.errorMessage());
    }

    private static void appendFilters(StringBuilder sql, List<Object> args, ListEventParams p) {
        if (p.type() != null) {
            sql.append(" AND type = ?");
            args.add(p.type());
        }
        if (p.source() != null) {
            sql.append(" AND source = ?");
            args.add(p.source());
        }
        if (p.status() != null) {
            sql.append(" AND status = ?");
            args.add(p.status().value());
        }
    }

    private static void appendSearchFilters(StringBuilder sql, List<Object> args, SearchQuery q) {
        for (String field : GROUPABLE_FIELDS) {
            String value = q.filter(field);
            if (value != null) {
                sql.append(" AND ").append(field).append(" = ?");
                args.add("type".equals(field) || "source".equals(field) ? value : value.toLowerCase());
            }
        }
        SearchQuery.TimeRange range = q.timeRange();
        if (range != null && range.start() != null) {
            sql.append(" AND created_at >= ?");
            args.add(Timestamp.from(range.start()));
        }
        if (range != null && range.end() != null) {
            sql.append(" AND created_at <= ?");
            args.add(Timestamp.from(range.end()));
        }
    }

    // Only whitelisted names are ever interpolated into SQL.
    private static String groupColumn(String field) {
        if (!GROUPABLE_FIELDS.contains(field)) {
            throw new ValidationException("cannot group by field: " + field);
        }
        return field;
    }

    private List<RtEvent> query(String sql, List<Object> args, String what) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, args);
            List<RtEvent> events = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(mapRow(rs));
                }
            }
            return events;
        } catch (Exception ex) {
            log.error("Failed to {}: {}", what, ex.getMessage(), ex);
            throw new StorageException("Failed to " + what, ex);
        }
    }

    private long queryLong(String sql, List<Object> args, String what) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (Exception ex) {
            log.error("Failed to {}: {}", what, ex.getMessage(), ex);
            throw new StorageException("Failed to " + what, ex);
        }
    }

    private int update(String sql, List<Object> args, String what) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, args);
            return ps.executeUpdate();
        } catch (Exception ex) {
            log.error("Failed to {}: {}", what, ex.getMessage(), ex);
            throw new StorageException("Failed to " + what, ex);
        }
    }

    private static void bind(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            Object arg = args.get(i);
            if (arg == null) {
                ps.setNull(i + 1, Types.VARCHAR);
            } else if (arg instanceof Timestamp ts) {
                ps.setTimestamp(i + 1, ts);
            } else if (arg instanceof Boolean b) {
                ps.setBoolean(i + 1, b);
            } else if (arg instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else {
                ps.setString(i + 1, arg.toString());
            }
        }
    }

    private static RtEvent mapRow(ResultSet rs) throws Exception {
        String payloadJson = rs.getString("payload");
        JsonNode payload = payloadJson != null ? Json.MAPPER.readTree(payloadJson) : null;
        Timestamp processedAt = rs.getTimestamp("processed_at");
        return new RtEvent(
                rs.getString("id"),
                rs.getString("type"),
                rs.getString("source"),
                payload,
                EventPriority.fromValue(rs.getString("priority")),
                EventStatus.fromValue(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                processedAt != null ? processedAt.toInstant() : null,
                rs.getInt("retry_count"),
                rs.getString("error_message"));
    }
}

package io.rthub.transport.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rthub.domain.common.EventHubException;
import io.rthub.domain.common.ValidationException;
import io.rthub.domain.event.EventDraft;
import io.rthub.domain.event.EventStatus;
import io.rthub.domain.event.ListEventParams;
import io.rthub.domain.event.RetryParams;
import io.rthub.domain.event.SearchQuery;
import io.rthub.domain.event.StatsParams;
import io.rthub.service.core.EventQueryService;
import io.rthub.service.core.EventService;
import io.rthub.transport.ws.WsHub;
import io.rthub.util.Json;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints of the event hub. Every response is JSON; failures are {"error": message}.
 */
public final class EventHandlers {
    private static final Logger log = LoggerFactory.getLogger(EventHandlers.class);

    public static final String SOURCE_HEADER = "X-Source";

    private final EventService events;
    private final EventQueryService queries;
    private final WsHub wsHub;

    public EventHandlers(EventService events, EventQueryService queries, WsHub wsHub) {
        this.events = events;
        this.queries = queries;
        this.wsHub = wsHub;
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /events, /rt/events - body {"event": {type, source, payload, priority}}
     */
    public void publish(HttpServerExchange exchange) {
        withBody(exchange, (ex, body) -> {
            CreateEventRequest request = Json.MAPPER.readValue(body, CreateEventRequest.class);
            EventDraft draft = request != null ? request.event() : null;
            sendJson(ex, StatusCodes.OK, events.publish(draft, ex.getRequestHeaders().getFirst(SOURCE_HEADER)));
        });
    }

    /**
     * POST /events/batch - body [{"event": {...}}, ...], at most 100 items
     */
    public void publishBatch(HttpServerExchange exchange) {
        withBody(exchange, (ex, body) -> {
            List<CreateEventRequest> requests = Json.MAPPER.readValue(body, new TypeReference<>() {});
            List<EventDraft> drafts = requests == null ? List.of()
                    : requests.stream().map(r -> r != null ? r.event() : null).toList();
            sendJson(ex, StatusCodes.OK, events.publishBatch(drafts, ex.getRequestHeaders().getFirst(SOURCE_HEADER)));
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // READ / DELETE
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /events/{id}
     */
    public void get(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, StatusCodes.OK, events.get(pathParam(exchange, "id"))));
    }

    /**
     * GET /events, /rt/events - type, source, status, cursor, limit, direction
     */
    public void list(HttpServerExchange exchange) {
        handle(exchange, () -> {
            String statusRaw = queryParam(exchange, "status");
            EventStatus status = null;
            if (statusRaw != null) {
                status = EventStatus.parse(statusRaw).orElseThrow(() -> new ValidationException(
                        "invalid status. Valid values: " + EventStatus.validValues()));
            }
            String direction = queryParam(exchange, "direction");
            if (direction != null && !direction.equalsIgnoreCase("forward") && !direction.equalsIgnoreCase("backward")) {
                throw new ValidationException("invalid direction. Valid values: forward, backward");
            }
            ListEventParams params = new ListEventParams(
                    queryParam(exchange, "type"),
                    queryParam(exchange, "source"),
                    status,
                    queryParam(exchange, "cursor"),
                    intParam(exchange, "limit", ListEventParams.DEFAULT_LIMIT),
                    direction);
            sendJson(exchange, StatusCodes.OK, events.list(params));
        });
    }

    /**
     * DELETE /events/{id}
     */
    public void delete(HttpServerExchange exchange) {
        handle(exchange, () -> {
            String id = pathParam(exchange, "id");
            events.delete(id);
            sendJson(exchange, StatusCodes.OK, Map.of("success", true, "id", id));
        });
    }

    /**
     * DELETE /events/batch - body {"ids": [...]}
     */
    public void deleteBatch(HttpServerExchange exchange) {
        withBody(exchange, (ex, body) -> {
            DeleteBatchRequest request = Json.MAPPER.readValue(body, DeleteBatchRequest.class);
            int deleted = events.deleteBatch(request != null ? request.ids() : null);
            sendJson(ex, StatusCodes.OK, Map.of("success", true, "deleted", deleted));
        });
    }

    /**
     * GET /events/history - type, source, limit (default 100, max 1000)
     */
    public void history(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, StatusCodes.OK, queries.history(
                queryParam(exchange, "type"),
                queryParam(exchange, "source"),
                intParam(exchange, "limit", EventQueryService.DEFAULT_HISTORY_LIMIT))));
    }

    /**
     * GET /events/types
     */
    public void types(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, StatusCodes.OK, Map.of("types", queries.eventTypes())));
    }

    /**
     * GET /events/sources
     */
    public void sources(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, StatusCodes.OK, Map.of("sources", queries.eventSources())));
    }

    // ═══════════════════════════════════════════════════════════════
    // PIPELINE
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /events/{id}/retry - body {reason, priority, retry_options: {max_attempts, delay_seconds}}, optional
     */
    public void retry(HttpServerExchange exchange) {
        withBody(exchange, (ex, body) -> {
            RetryParams params = body.length == 0 ? RetryParams.none()
                    : Json.MAPPER.readValue(body, RetryParams.class);
            sendJson(ex, StatusCodes.OK, events.retryEvent(pathParam(ex, "id"), params));
        });
    }

    /**
     * DELETE /events/retries/{retryId}
     */
    public void cancelRetry(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, StatusCodes.OK, events.cancelRetry(pathParam(exchange, "retryId"))));
    }

    /**
     * GET /events/failed - limit (default 50, 1..200)
     */
    public void failed(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, StatusCodes.OK, events.getFailedEvents(
                intParam(exchange, "limit", EventService.DEFAULT_FAILED_LIMIT))));
    }

    /**
     * POST /events/process - limit (default 10, max 50)
     */
    public void processPending(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, StatusCodes.OK, events.processPendingEvents(
                intParam(exchange, "limit", EventService.DEFAULT_PROCESS_LIMIT))));
    }

    /**
     * PUT /events/{id}/status - body {status, error_message}
     */
    public void updateStatus(HttpServerExchange exchange) {
        withBody(exchange, (ex, body) -> {
            StatusUpdateRequest request = Json.MAPPER.readValue(body, StatusUpdateRequest.class);
            if (request == null || request.status() == null || request.status().isBlank()) {
                throw new ValidationException("status is required");
            }
            sendJson(ex, StatusCodes.OK,
                    events.updateEventStatus(pathParam(ex, "id"), request.status(), request.errorMessage()));
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // SEARCH / STATS / HEALTH
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /search
     */
    public void search(HttpServerExchange exchange) {
        withBody(exchange, (ex, body) -> {
            SearchQuery query = body.length == 0 ? null : Json.MAPPER.readValue(body, SearchQuery.class);
            sendJson(ex, StatusCodes.OK, queries.search(query));
        });
    }

    /**
     * GET /stats/realtime - interval (default 5m), type (default overview)
     */
    public void realtimeStats(HttpServerExchange exchange) {
        handle(exchange, () -> sendJson(exchange, StatusCodes.OK, queries.realtimeStats(new StatsParams(
                queryParam(exchange, "interval"), queryParam(exchange, "type")))));
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        handle(exchange, () -> {
            ObjectNode health = Json.MAPPER.createObjectNode();
            health.put("status", "ok");
            health.put("ts", Instant.now().toString());
            ObjectNode hub = health.putObject("hub");
            hub.put("connections", wsHub.connectionCount());
            hub.put("users", wsHub.userCount());
            ObjectNode pipeline = health.putObject("pipeline");
            pipeline.put("queue_depth", events.queueDepth());
            sendJson(exchange, StatusCodes.OK, health);
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    @FunctionalInterface
    private interface Action {
        void run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        void accept(HttpServerExchange exchange, byte[] body) throws Exception;
    }

    private void withBody(HttpServerExchange exchange, BodyAction action) {
        exchange.getRequestReceiver().receiveFullBytes(
                (ex, body) -> handle(ex, () -> action.accept(ex, body)),
                (ex, e) -> {
                    log.warn("Failed to read request body for {}: {}", ex.getRequestPath(), e.toString());
                    sendError(ex, StatusCodes.BAD_REQUEST, "failed to read request body");
                });
    }

    private void handle(HttpServerExchange exchange, Action action) {
        try {
            action.run();
        } catch (EventHubException e) {
            if (e.getStatusCode() >= 500) {
                log.error("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                        e.getMessage(), e);
            } else {
                log.debug("{} {} rejected: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage());
            }
            sendError(exchange, e.getStatusCode(), e.getPublicMessage());
        } catch (JsonProcessingException e) {
            log.debug("Invalid JSON on {}: {}", exchange.getRequestPath(), e.getOriginalMessage());
            sendError(exchange, StatusCodes.BAD_REQUEST, "invalid JSON body");
        } catch (Exception e) {
            log.error("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "internal server error");
        }
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        String value = queryParam(exchange, name);
        if (value == null) {
            throw new ValidationException(name + " is required");
        }
        return value;
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.getFirst();
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intParam(HttpServerExchange exchange, String name, int defaultValue) {
        String value = queryParam(exchange, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static void sendJson(HttpServerExchange exchange, int status, Object body) throws JsonProcessingException {
        String json = Json.MAPPER.writeValueAsString(body);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode error = Json.MAPPER.createObjectNode();
        error.put("error", message);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(error.toString(), StandardCharsets.UTF_8);
    }

    // Request bodies
    public record CreateEventRequest(@JsonProperty("event") EventDraft event) {
    }

    public record DeleteBatchRequest(@JsonProperty("ids") List<String> ids) {
    }

    public record StatusUpdateRequest(
            @JsonProperty("status") String status,
            @JsonProperty("error_message") String errorMessage) {
    }
}

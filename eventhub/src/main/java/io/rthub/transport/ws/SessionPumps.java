package io.rthub.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rthub.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * The two loops that serve one session. Whatever ends a loop, the session is unregistered
 * and nothing escapes to the executor.
 */
final class SessionPumps {
    private static final Logger log = LoggerFactory.getLogger(SessionPumps.class);

    private final WsHub hub;
    private final Duration pingInterval;

    SessionPumps(WsHub hub, Duration pingInterval) {
        this.hub = hub;
        this.pingInterval = pingInterval;
    }

    Runnable readPump(ClientSession session) {
        return () -> runReadPump(session);
    }

    Runnable writePump(ClientSession session) {
        return () -> runWritePump(session);
    }

    private void runReadPump(ClientSession session) {
        SessionConnection conn = session.connection();
        try {
            while (!session.isClosed()) {
                SessionConnection.Frame frame = conn.readFrame();
                if (frame == null) {
                    log.debug("[HUB] Peer closed session {}", session.id());
                    break;
                }
                session.touch(hub.now());
                if (!frame.pong()) {
                    handleClientFrame(session, frame.text());
                }
            }
        } catch (SocketTimeoutException e) {
            log.info("[HUB] Session {} idle timeout: {}", session.id(), e.getMessage());
        } catch (IOException e) {
            log.debug("[HUB] Read failed for session {}: {}", session.id(), e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("[HUB] Read pump crashed for session {}", session.id(), e);
        } finally {
            hub.unregisterClient(session.id());
        }
    }

    private void runWritePump(ClientSession session) {
        SessionConnection conn = session.connection();
        try {
            while (true) {
                String frame = session.poll(pingInterval);
                if (frame == null) {
                    conn.ping();
                    continue;
                }
                if (ClientSession.isEndOfStream(frame)) {
                    break;
                }
                conn.writeText(frame);
            }
        } catch (IOException e) {
            log.debug("[HUB] Write failed for session {}: {}", session.id(), e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("[HUB] Write pump crashed for session {}", session.id(), e);
        } finally {
            hub.unregisterClient(session.id());
            conn.close();
        }
    }

    private void handleClientFrame(ClientSession session, String raw) {
        JsonNode msg;
        try {
            msg = Json.MAPPER.readTree(raw);
        } catch (IOException e) {
            log.debug("[HUB] Ignoring unparseable frame from session {}: {}", session.id(), e.getMessage());
            return;
        }
        if (msg == null || !msg.isObject()) {
            log.debug("[HUB] Ignoring non-object frame from session {}", session.id());
            return;
        }

        String type = msg.path("type").asText("");
        switch (type) {
            case "subscribe" -> {
                List<String> topics = topicsOf(msg);
                session.subscribe(topics);
                hub.sendTo(session, ack(session, "subscribe", topics));
            }
            case "unsubscribe" -> {
                List<String> topics = topicsOf(msg);
                session.unsubscribe(topics);
                hub.sendTo(session, ack(session, "unsubscribe", topics));
            }
            case "ping" -> {
                ObjectNode data = Json.MAPPER.createObjectNode();
                data.put("session_id", session.id());
                hub.sendTo(session, HubMessage.of(HubMessage.PONG, data));
            }
            default -> log.debug("[HUB] Ignoring frame type '{}' from session {}", type, session.id());
        }
    }

    private static List<String> topicsOf(JsonNode msg) {
        List<String> topics = new ArrayList<>();
        String channel = msg.path("channel").asText("");
        if (!channel.isBlank()) {
            topics.add(channel);
        }
        for (JsonNode node : msg.path("channels")) {
            if (node.isTextual() && !node.asText().isBlank()) {
                topics.add(node.asText());
            }
        }
        return topics;
    }

    private static HubMessage ack(ClientSession session, String action, List<String> topics) {
        ObjectNode data = Json.MAPPER.createObjectNode();
        data.put("action", action);
        data.put("session_id", session.id());
        ArrayNode changed = data.putArray("channels");
        topics.forEach(changed::add);
        ArrayNode current = data.putArray("subscriptions");
        session.subscriptions().forEach(current::add);
        String channel = topics.size() == 1 ? topics.get(0) : null;
        return new HubMessage(HubMessage.ACK, channel, data);
    }
}

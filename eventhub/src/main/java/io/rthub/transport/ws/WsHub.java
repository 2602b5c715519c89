package io.rthub.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rthub.config.HubConfig;
import io.rthub.infrastructure.metrics.HubMetrics;
import io.rthub.util.Json;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Connection hub: registry of live sessions plus fan-out of server frames.
 *
 * - One read pump and one write pump per session, on the hub's pump executor
 * - Broadcasts never block: a full session queue drops the frame for that session only
 * - Topic and per-user delivery
 * - Periodic sweep of sessions with no inbound activity
 *
 * Register, unregister and each broadcast iteration run under one registry lock.
 */
public final class WsHub {
    private static final Logger log = LoggerFactory.getLogger(WsHub.class);

    private final HubConfig config;
    private final HubMetrics metrics;
    private final Clock clock;
    private final SessionPumps pumps;

    private final ReentrantLock registryLock = new ReentrantLock();
    // guarded by registryLock
    private final Map<String, ClientSession> sessions = new HashMap<>();
    private boolean shutdown;

    private final AtomicInteger pumpThreads = new AtomicInteger();
    private final ExecutorService pumpExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ws-pump-" + pumpThreads.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final ScheduledExecutorService maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-maintenance");
        t.setDaemon(true);
        return t;
    });

    private final AtomicLong wsSeq = new AtomicLong(0);

    public WsHub(HubConfig config, HubMetrics metrics) {
        this(config, metrics, Clock.systemUTC());
    }

    public WsHub(HubConfig config, HubMetrics metrics, Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.pumps = new SessionPumps(this, config.pingInterval());
    }

    public void start() {
        long periodMs = config.maintenanceInterval().toMillis();
        maintenance.scheduleAtFixedRate(this::runMaintenance, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("[HUB] Started (queue={}, ping={}s, stale after {}s)",
                config.queueCapacity(), config.pingInterval().toSeconds(), config.staleAfter().toSeconds());
    }

    /**
     * WebSocket upgrade handler. {@code identityResolver} maps the handshake to a user id;
     * connections without one get an error frame and are closed.
     */
    public WebSocketProtocolHandshakeHandler websocketHandler(Function<WebSocketHttpExchange, String> identityResolver) {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String userId = identityResolver.apply(exchange);
                if (userId == null || userId.isBlank()) {
                    log.warn("[HUB] Connection rejected: missing user id from {}", channel.getSourceAddress());
                    ObjectNode data = Json.MAPPER.createObjectNode();
                    data.put("error", "user id is required");
                    String frame = serialize(HubMessage.of(HubMessage.ERROR, data));
                    if (frame != null) {
                        WebSockets.sendText(frame, channel, null);
                    }
                    WebSockets.sendClose(CloseMessage.MSG_VIOLATES_POLICY, "user id is required", channel, null);
                    return;
                }

                UndertowSessionConnection conn = new UndertowSessionConnection(
                        channel, config.idleTimeout(), config.inboundCapacity());
                conn.bind();
                try {
                    openSession(userId, conn);
                } catch (IllegalStateException e) {
                    log.warn("[HUB] Connection from {} refused: {}", channel.getSourceAddress(), e.getMessage());
                    conn.close();
                }
            }
        });
    }

    /**
     * Creates a session for an accepted connection and registers it.
     */
    public ClientSession openSession(String userId, SessionConnection connection) {
        ClientSession session = new ClientSession(
                UUID.randomUUID().toString(), userId, connection, config.queueCapacity(), now());
        registerClient(session);
        return session;
    }

    /**
     * Adds the session to the registry and starts its pumps. Returns without waiting for them.
     *
     * @throws IllegalStateException if the id is already registered or the hub is shut down
     */
    public void registerClient(ClientSession session) {
        int count;
        registryLock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("hub is shut down");
            }
            if (sessions.containsKey(session.id())) {
                throw new IllegalStateException("session already registered: " + session.id());
            }
            sessions.put(session.id(), session);
            count = sessions.size();
        } finally {
            registryLock.unlock();
        }
        metrics.setSessions(count);

        try {
            pumpExecutor.execute(pumps.readPump(session));
            pumpExecutor.execute(pumps.writePump(session));
        } catch (RejectedExecutionException e) {
            log.warn("[HUB] Pump executor rejected session {}", session.id());
            unregisterClient(session.id());
            session.connection().close();
            throw new IllegalStateException("hub is shut down", e);
        }

        log.info("[HUB] Connected: {} (user={}, session={}, total={})",
                session.connection().remoteAddress(), session.userId(), session.id(), count);
    }

    /**
     * Removes the session and closes its outbound queue. Safe to call repeatedly.
     *
     * @return true if this call removed it
     */
    public boolean unregisterClient(String sessionId) {
        ClientSession removed;
        int count;
        registryLock.lock();
        try {
            removed = sessions.remove(sessionId);
            count = sessions.size();
        } finally {
            registryLock.unlock();
        }
        if (removed == null) {
            return false;
        }
        removed.closeOutbound();
        metrics.setSessions(count);
        log.info("[HUB] Disconnected: session={} user={} (dropped frames={}, total={})",
                sessionId, removed.userId(), removed.droppedFrames(), count);
        return true;
    }

    /**
     * @return number of sessions the frame was queued for
     */
    public int broadcastToAll(HubMessage message) {
        return broadcast(message, s -> true);
    }

    public int broadcastToTopic(String topic, HubMessage message) {
        return broadcast(message.onChannel(topic), s -> s.isSubscribed(topic));
    }

    public int broadcastToUser(String userId, HubMessage message) {
        return broadcast(message, s -> s.userId().equals(userId));
    }

    private int broadcast(HubMessage message, Predicate<ClientSession> target) {
        String frame = serialize(message);
        if (frame == null) {
            return 0;
        }
        int queued = 0;
        registryLock.lock();
        try {
            for (ClientSession session : sessions.values()) {
                if (!target.test(session)) {
                    continue;
                }
                if (session.offer(frame)) {
                    queued++;
                } else {
                    metrics.recordFrameDropped();
                    log.debug("[HUB] Queue full, dropped {} frame for session {}", message.type(), session.id());
                }
            }
        } finally {
            registryLock.unlock();
        }
        metrics.recordFramesQueued(queued);
        return queued;
    }

    /**
     * Queues a frame for one session (acks, pongs).
     */
    boolean sendTo(ClientSession session, HubMessage message) {
        String frame = serialize(message);
        if (frame == null) {
            return false;
        }
        boolean queued = session.offer(frame);
        if (!queued && !session.isClosed()) {
            metrics.recordFrameDropped();
        }
        return queued;
    }

    private String serialize(HubMessage message) {
        ObjectNode envelope = Json.MAPPER.createObjectNode();
        envelope.put("type", message.type());
        if (message.channel() != null) {
            envelope.put("channel", message.channel());
        }
        envelope.set("data", message.data());
        envelope.put("ts", now().toString());
        envelope.put("seq", wsSeq.incrementAndGet());
        try {
            return Json.MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.warn("[HUB] Failed to serialize {} frame: {}", message.type(), e.toString());
            return null;
        }
    }

    /**
     * Unregisters sessions with no inbound activity for longer than the stale threshold.
     *
     * @return number of sessions removed
     */
    public int sweepStale(Instant now) {
        Instant cutoff = now.minus(config.staleAfter());
        List<String> stale = new ArrayList<>();
        registryLock.lock();
        try {
            for (ClientSession session : sessions.values()) {
                if (session.lastActivity().isBefore(cutoff)) {
                    stale.add(session.id());
                }
            }
        } finally {
            registryLock.unlock();
        }
        int removed = 0;
        for (String id : stale) {
            if (unregisterClient(id)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("[HUB] Maintenance removed {} stale session(s)", removed);
        }
        return removed;
    }

    private void runMaintenance() {
        try {
            sweepStale(now());
        } catch (RuntimeException e) {
            log.warn("[HUB] Maintenance sweep failed: {}", e.toString());
        }
    }

    /**
     * Closes every session and stops the executors.
     */
    public void shutdown() {
        List<String> ids;
        registryLock.lock();
        try {
            shutdown = true;
            ids = new ArrayList<>(sessions.keySet());
        } finally {
            registryLock.unlock();
        }
        ids.forEach(this::unregisterClient);
        maintenance.shutdownNow();
        pumpExecutor.shutdown();
        try {
            if (!pumpExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                pumpExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            pumpExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[HUB] Shut down ({} session(s) closed)", ids.size());
    }

    public Optional<ClientSession> getSession(String sessionId) {
        registryLock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            registryLock.unlock();
        }
    }

    public List<ClientSession> sessionsForUser(String userId) {
        registryLock.lock();
        try {
            return sessions.values().stream().filter(s -> s.userId().equals(userId)).toList();
        } finally {
            registryLock.unlock();
        }
    }

    public int connectionCount() {
        registryLock.lock();
        try {
            return sessions.size();
        } finally {
            registryLock.unlock();
        }
    }

    public int userCount() {
        registryLock.lock();
        try {
            return (int) sessions.values().stream().map(ClientSession::userId).distinct().count();
        } finally {
            registryLock.unlock();
        }
    }

    Instant now() {
        return clock.instant();
    }
}

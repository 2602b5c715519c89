package io.rthub.config;

import io.rthub.util.Env;

import java.time.Duration;

/**
 * Connection hub settings.
 *
 * @param queueCapacity       outbound frames buffered per session before broadcasts are dropped for it
 * @param idleTimeout         read pump gives up when nothing (text or pong) arrives for this long
 * @param pingInterval        write pump sends a keep-alive ping after this much outbound silence
 * @param staleAfter          maintenance sweep removes sessions idle for longer than this
 * @param maintenanceInterval how often the maintenance sweep runs
 * @param inboundCapacity     inbound frames buffered between the socket and the read pump
 */
public record HubConfig(
        int queueCapacity,
        Duration idleTimeout,
        Duration pingInterval,
        Duration staleAfter,
        Duration maintenanceInterval,
        int inboundCapacity
) {
    public static final int DEFAULT_QUEUE_CAPACITY = 256;

    public HubConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        if (inboundCapacity <= 0) {
            throw new IllegalArgumentException("inboundCapacity must be positive: " + inboundCapacity);
        }
    }

    public static HubConfig defaults() {
        return new HubConfig(
                DEFAULT_QUEUE_CAPACITY,
                Duration.ofSeconds(60),
                Duration.ofSeconds(30),
                Duration.ofMinutes(2),
                Duration.ofSeconds(30),
                64);
    }

    public static HubConfig fromEnv() {
        HubConfig d = defaults();
        return new HubConfig(
                Env.getPositiveInt("WS_QUEUE_CAPACITY", d.queueCapacity()),
                Env.getSeconds("WS_IDLE_TIMEOUT_SEC", d.idleTimeout()),
                Env.getSeconds("WS_PING_INTERVAL_SEC", d.pingInterval()),
                Env.getSeconds("WS_STALE_AFTER_SEC", d.staleAfter()),
                Env.getSeconds("WS_MAINTENANCE_SEC", d.maintenanceInterval()),
                Env.getPositiveInt("WS_INBOUND_CAPACITY", d.inboundCapacity()));
    }
}

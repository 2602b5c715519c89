package io.rthub.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Server frame before it is wrapped in the wire envelope
 * {@code {"type", "channel", "data", "ts", "seq"}}.
 *
 * @param channel topic the frame belongs to, or null
 */
public record HubMessage(String type, String channel, JsonNode data) {

    public static final String EVENT = "event";
    public static final String ACK = "ack";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    public static HubMessage of(String type, JsonNode data) {
        return new HubMessage(type, null, data);
    }

    public HubMessage onChannel(String topic) {
        return new HubMessage(type, topic, data);
    }
}

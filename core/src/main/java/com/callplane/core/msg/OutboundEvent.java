package com.callplane.core.msg;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Event waiting to be published on the bus.
 * <p>
 * <b>Immutability:</b> the metadata map is copied on construction, so an event
 * can be queued and handed to another connection generation safely.
 * </p>
 */
@Value
public class OutboundEvent {
    /**
     * Event name, used for logging only.
     */
    String name;

    /**
     * Payload. {@code byte[]} and {@code String} are sent as-is, anything else is
     * serialized to JSON.
     */
    Object body;

    /**
     * Transport headers.
     */
    Map<String, String> metadata;

    /**
     * Routing key on the publish exchange.
     */
    String routingKey;

    @Builder(toBuilder = true)
    public OutboundEvent(String name, Object body, Map<String, String> metadata, String routingKey) {
        this.name = name;
        this.body = body;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.routingKey = routingKey;
    }
}

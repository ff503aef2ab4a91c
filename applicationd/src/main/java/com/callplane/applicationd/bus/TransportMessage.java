package com.callplane.applicationd.bus;

import lombok.Value;

import java.util.Map;

/**
 * Serialized outbound event as handed to the broker session.
 */
@Value
public class TransportMessage {
    String routingKey;
    Map<String, String> headers;
    byte[] body;
}

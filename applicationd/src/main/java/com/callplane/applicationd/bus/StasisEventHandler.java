package com.callplane.applicationd.bus;

import com.callplane.core.msg.Context;
import com.callplane.core.msg.StasisEvent;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Business callback for one inbound event type.
 */
@FunctionalInterface
public interface StasisEventHandler {

    /**
     * Handles one event. The consumer waits for the returned Mono before taking
     * the next message from the bus.
     *
     * @param context origin of the event
     * @param event   routing information (asterisk id and application name)
     * @param payload the whole decoded document
     * @return Mono completing when the event is handled
     */
    Mono<Void> handle(Context context, StasisEvent event, JsonNode payload);
}

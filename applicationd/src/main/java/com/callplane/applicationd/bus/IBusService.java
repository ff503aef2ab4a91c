package com.callplane.applicationd.bus;

import com.callplane.core.msg.OutboundEvent;
import reactor.core.publisher.Mono;

/**
 * Message bus facade used by the business layer.
 */
public interface IBusService {

    /**
     * Keeps the bus connected and pumping until the subscription is disposed.
     */
    Mono<Void> run();

    /**
     * Queues an event for publication. Never blocks, even while disconnected.
     */
    void publish(OutboundEvent event);

    /**
     * Registers the handler of an event type. Must be called before {@link #run()};
     * a second registration for the same type replaces the first.
     */
    void onEvent(String type, StasisEventHandler handler);
}

package com.callplane.applicationd.bus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One live broker connection, owned by the {@link BusSupervisor}.
 */
public interface BrokerSession {

    /**
     * Deliveries from the dispatcher queue, each waiting for an ack.
     */
    Flux<InboundMessage> inbound();

    /**
     * Publishes the messages in order on the publish exchange, without confirms.
     *
     * @return Mono completing when the source completes
     */
    Mono<Void> publish(Flux<TransportMessage> messages);

    /**
     * Completes when the connection is lost or closed.
     */
    Mono<Void> closed();

    /**
     * Best-effort close of the connection.
     */
    void close();
}

package com.callplane.applicationd.bus;

import reactor.core.publisher.Mono;

/**
 * Opens broker connections for the {@link BusSupervisor}.
 */
public interface BrokerConnector {

    /**
     * Connects and declares the exchanges and queue the dispatcher needs.
     * A partially opened connection is closed before the error is signalled.
     *
     * @return Mono emitting a live session, or an error if the broker cannot be reached
     */
    Mono<BrokerSession> connect();
}

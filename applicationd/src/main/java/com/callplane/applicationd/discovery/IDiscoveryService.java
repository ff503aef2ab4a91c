package com.callplane.applicationd.discovery;

import com.callplane.core.model.Application;
import com.callplane.core.model.AsteriskNode;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Service catalog membership, leader-gated node watch and application records.
 */
public interface IDiscoveryService {

    /**
     * Registers the process, then campaigns for the watch duties until cancelled.
     */
    Mono<Void> run();

    /**
     * Appends a callback fired when a node becomes OK. Callbacks run in registration order.
     */
    void onNodeOK(NodeHandler handler);

    /**
     * Appends a callback fired when a node becomes KO. Callbacks run in registration order.
     */
    void onNodeKO(NodeHandler handler);

    /**
     * Records an application in the catalog.
     * <p>
     * Signals {@link IllegalArgumentException} for an invalid name. A catalog failure is
     * logged and the application is still emitted.
     * </p>
     */
    Mono<Application> registerApplication(String name);

    Mono<Boolean> isApplicationRegistered(String name);

    /**
     * One-shot listing of the Asterisk nodes currently in the catalog.
     * Emits an empty list when the catalog cannot be queried.
     */
    Mono<List<AsteriskNode>> retrieveAsteriskServices();
}

package com.callplane.applicationd.discovery.election;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Cluster-wide election on a named key.
 */
public interface ILeaderElection {

    /**
     * Campaigns for {@code key} until cancelled.
     * <p>
     * The returned Mono only completes when cancelled. If leadership is held at that
     * moment, {@link LeadershipListener#onLoseLeadership()} is invoked before the lock
     * is given back.
     * </p>
     *
     * @param key          election key shared by all replicas
     * @param listener     notified of each transition
     * @param healthChecks catalog checks that must stay passing while leadership is held
     */
    Mono<Void> startElection(String key, LeadershipListener listener, List<String> healthChecks);

    default void close() {
        // nothing held by default
    }
}

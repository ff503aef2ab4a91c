package com.callplane.applicationd.discovery.election;

import reactor.core.publisher.Mono;

/**
 * Receives leadership transitions from an {@link ILeaderElection}.
 * Calls alternate: never two {@code onBecomeLeader} in a row.
 */
public interface LeadershipListener {

    Mono<Void> onBecomeLeader();

    Mono<Void> onLoseLeadership();
}

package com.callplane.applicationd.support;

import com.callplane.applicationd.discovery.election.ILeaderElection;
import com.callplane.applicationd.discovery.election.LeadershipListener;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Election driven by the test: leadership changes only when the test says so.
 */
public class ManualElection implements ILeaderElection {
    private volatile LeadershipListener listener;
    private volatile String key;
    private volatile List<String> healthChecks;
    private final AtomicInteger cancellations = new AtomicInteger();

    @Override
    public Mono<Void> startElection(String key, LeadershipListener listener, List<String> healthChecks) {
        return Mono.<Void>never()
            .doOnSubscribe(s -> {
                this.key = key;
                this.listener = listener;
                this.healthChecks = healthChecks;
            })
            .doOnCancel(cancellations::incrementAndGet);
    }

    public void elect() {
        listener.onBecomeLeader().block();
    }

    public void depose() {
        listener.onLoseLeadership().block();
    }

    public boolean isStarted() {
        return listener != null;
    }

    public String key() {
        return key;
    }

    public List<String> healthChecks() {
        return healthChecks;
    }

    public int cancellations() {
        return cancellations.get();
    }
}

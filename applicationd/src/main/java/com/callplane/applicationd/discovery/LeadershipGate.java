package com.callplane.applicationd.discovery;

import com.callplane.applicationd.discovery.election.ILeaderElection;
import com.callplane.applicationd.discovery.election.LeadershipListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs a {@link NodeWatchLoop} only while this replica holds leadership.
 * <p>
 * Each leadership term gets a fresh loop from the factory. Losing leadership, or
 * cancelling {@link #run()}, cancels the loop and waits for it to terminate, so no node
 * callback fires afterwards.
 * </p>
 */
public class LeadershipGate implements LeadershipListener {
    private static final Logger log = LoggerFactory.getLogger(LeadershipGate.class);

    private final ILeaderElection election;
    private final String electionKey;
    private final List<String> healthChecks;
    private final Supplier<NodeWatchLoop> watchFactory;

    private final AtomicReference<RunningWatch> running = new AtomicReference<>();

    public LeadershipGate(
        ILeaderElection election,
        String electionKey,
        List<String> healthChecks,
        Supplier<NodeWatchLoop> watchFactory
    ) {
        this.election = election;
        this.electionKey = electionKey;
        this.healthChecks = List.copyOf(healthChecks);
        this.watchFactory = watchFactory;
    }

    /**
     * Campaigns on the election key until cancelled.
     */
    public Mono<Void> run() {
        return Mono.usingWhen(
            Mono.just(this),
            gate -> election.startElection(electionKey, gate, healthChecks),
            gate -> gate.stopWatch(),
            (gate, err) -> gate.stopWatch(),
            gate -> gate.stopWatch());
    }

    @Override
    public Mono<Void> onBecomeLeader() {
        return Mono.fromRunnable(() -> {
            RunningWatch watch = new RunningWatch();
            if (!running.compareAndSet(null, watch)) {
                log.warn("Node watch already running, ignoring leadership notification on {}", electionKey);
                return;
            }
            log.info("Leader on {}, starting node watch", electionKey);
            watch.start(watchFactory.get());
        });
    }

    @Override
    public Mono<Void> onLoseLeadership() {
        return Mono.defer(this::stopWatch);
    }

    public boolean isWatching() {
        return running.get() != null;
    }

    private Mono<Void> stopWatch() {
        RunningWatch watch = running.getAndSet(null);
        if (watch == null) {
            return Mono.empty();
        }
        log.info("Stopping node watch on {}", electionKey);
        return watch.stop();
    }

    private static final class RunningWatch {
        private final Sinks.Empty<Void> terminated = Sinks.empty();
        private final Disposable.Swap subscription = Disposables.swap();

        void start(NodeWatchLoop loop) {
            subscription.update(loop.run()
                .doFinally(signal -> terminated.tryEmitEmpty())
                .subscribe(null, err -> log.error("Node watch terminated with error: {}", err.getMessage(), err)));
        }

        Mono<Void> stop() {
            // a Swap disposed before start() disposes the subscription as soon as it is set
            subscription.dispose();
            return terminated.asMono();
        }
    }
}

package com.callplane.applicationd.discovery;

import com.callplane.applicationd.discovery.catalog.HealthServiceResult;
import com.callplane.applicationd.discovery.catalog.ICatalogClient;
import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.core.model.AsteriskNode;
import com.callplane.core.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches the health of a catalog service and fires edge-triggered node callbacks.
 * <p>
 * Priming loads the full node set and reports every node once, so a new leader starts
 * from the complete world state. Polling then issues blocking queries and reports a node
 * only when its status differs from the shadow table. Nodes missing from a later answer
 * stay in the shadow table untouched.
 * </p>
 * <p>
 * An instance runs once: its shadow table and index are dropped when it stops and a new
 * leadership term builds a new loop.
 * </p>
 */
public class NodeWatchLoop {
    private static final Logger log = LoggerFactory.getLogger(NodeWatchLoop.class);

    private final ICatalogClient catalog;
    private final String serviceName;
    private final Duration wait;
    private final Duration primingRetry;
    private final List<NodeHandler> onNodeOk;
    private final List<NodeHandler> onNodeKo;
    private final MetricsService metrics;

    private final Map<String, AsteriskNode> shadow = new ConcurrentHashMap<>();
    private volatile String index;
    private volatile WatchState state = WatchState.PRIMING;

    public NodeWatchLoop(
        ICatalogClient catalog,
        String serviceName,
        Duration wait,
        Duration primingRetry,
        List<NodeHandler> onNodeOk,
        List<NodeHandler> onNodeKo,
        MetricsService metrics
    ) {
        this.catalog = catalog;
        this.serviceName = serviceName;
        this.wait = wait;
        this.primingRetry = primingRetry;
        this.onNodeOk = onNodeOk;
        this.onNodeKo = onNodeKo;
        this.metrics = metrics;
    }

    /**
     * Primes then polls until cancelled. Catalog errors never terminate the returned Mono.
     */
    public Mono<Void> run() {
        return Mono.defer(this::prime)
            .retryWhen(RetryPolicy.fixedDelayForever(primingRetry, log, "Priming watch on " + serviceName))
            .then(Mono.defer(this::poll)
                .onErrorResume(err -> {
                    log.error("Catalog error while watching {}: {}", serviceName, err.getMessage());
                    return Mono.empty();
                })
                .repeat()
                .then())
            .doFinally(signal -> stop());
    }

    private Mono<Void> prime() {
        state = WatchState.PRIMING;
        index = null;
        shadow.clear();

        return catalog.healthService(serviceName, null, null)
            .flatMap(result -> {
                List<AsteriskNode> nodes = NodeRecords.toNodes(result.getRecords());
                index = result.getIndex();
                nodes.forEach(node -> shadow.put(node.getId(), node));
                state = WatchState.POLLING;
                log.info("Watch on {} primed with {} node(s) at index {}", serviceName, nodes.size(), index);

                return Flux.fromIterable(nodes)
                    .concatMap(this::fire)
                    .then();
            });
    }

    private Mono<Void> poll() {
        return catalog.healthService(serviceName, wait, index)
            .flatMap(this::apply);
    }

    private Mono<Void> apply(HealthServiceResult result) {
        if (Objects.equals(result.getIndex(), index)) {
            return Mono.empty();
        }
        log.debug("Catalog index for {} moved from {} to {}", serviceName, index, result.getIndex());
        index = result.getIndex();

        return Flux.fromIterable(NodeRecords.toNodes(result.getRecords()))
            .concatMap(this::observe)
            .then();
    }

    private Mono<Void> observe(AsteriskNode node) {
        AsteriskNode previous = shadow.get(node.getId());
        boolean changed = previous == null || previous.getStatus() != node.getStatus();

        return (changed ? fire(node) : Mono.<Void>empty())
            .then(Mono.fromRunnable(() -> shadow.put(node.getId(), node)));
    }

    private Mono<Void> fire(AsteriskNode node) {
        List<NodeHandler> handlers = node.isOk() ? onNodeOk : onNodeKo;
        metrics.recordNodeTransition(node.getStatus());
        log.info("Asterisk node {} ({}:{}) is {}", node.getId(), node.getAddress(), node.getPort(), node.getStatus());

        return Flux.fromIterable(handlers)
            .concatMap(handler -> Mono.defer(() -> handler.handle(node))
                .onErrorResume(err -> {
                    log.error("Node callback failed for {}: {}", node.getId(), err.getMessage(), err);
                    return Mono.empty();
                }))
            .then();
    }

    private void stop() {
        state = WatchState.STOPPED;
        shadow.clear();
        index = null;
        log.info("Watch on {} stopped", serviceName);
    }

    public WatchState getState() {
        return state;
    }

    /**
     * Last index seen, null before priming and after stop.
     */
    public String getIndex() {
        return index;
    }

    public Map<String, AsteriskNode> shadowSnapshot() {
        return Map.copyOf(shadow);
    }
}

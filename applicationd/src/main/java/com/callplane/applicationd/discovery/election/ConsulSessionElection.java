package com.callplane.applicationd.discovery.election;

import com.callplane.applicationd.discovery.catalog.ICatalogClient;
import com.callplane.applicationd.discovery.catalog.KvEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Leader election on a Consul key lock.
 * <p>
 * Each campaign creates a session bound to the agent's {@code serfHealth} check and the
 * caller's checks, then tries to acquire the key. The leader watches the key until its
 * session no longer holds it (check failure, session invalidation, operator action).
 * Followers watch the key until it is free and try again. Sessions are destroyed when a
 * campaign ends for any reason.
 * </p>
 */
public class ConsulSessionElection implements ILeaderElection {
    private static final Logger log = LoggerFactory.getLogger(ConsulSessionElection.class);

    static final String SERF_HEALTH = "serfHealth";

    private final ICatalogClient catalog;
    private final String nodeId;
    private final Duration watchWait;
    private final Duration retryDelay;

    public ConsulSessionElection(ICatalogClient catalog, String nodeId, Duration watchWait, Duration retryDelay) {
        this.catalog = catalog;
        this.nodeId = nodeId;
        this.watchWait = watchWait;
        this.retryDelay = retryDelay;
    }

    @Override
    public Mono<Void> startElection(String key, LeadershipListener listener, List<String> healthChecks) {
        List<String> checks = new ArrayList<>();
        checks.add(SERF_HEALTH);
        checks.addAll(healthChecks);

        return Mono.defer(() -> campaign(key, listener, checks))
            .onErrorResume(err -> {
                log.error("Election on {} interrupted: {}. Will retry in {} seconds",
                    key, err.getMessage(), retryDelay.toSeconds());
                return Mono.empty();
            })
            .then(Mono.delay(retryDelay))
            .repeat()
            .then();
    }

    private Mono<Void> campaign(String key, LeadershipListener listener, List<String> checks) {
        return Mono.usingWhen(
            catalog.createSession(nodeId, checks)
                .doOnNext(sessionId -> log.debug("Session {} created for election on {}", sessionId, key)),
            sessionId -> contend(key, sessionId, listener),
            this::destroy,
            (sessionId, err) -> destroy(sessionId),
            this::destroy);
    }

    private Mono<Void> contend(String key, String sessionId, LeadershipListener listener) {
        return Mono.defer(() -> catalog.acquire(key, nodeId, sessionId))
            .flatMap(acquired -> acquired ? lead(key, sessionId, listener) : follow(key))
            .repeat()
            .then();
    }

    private Mono<Void> lead(String key, String sessionId, LeadershipListener listener) {
        return Mono.usingWhen(
            Mono.defer(() -> {
                log.info("Leadership acquired on {} by {}", key, nodeId);
                return listener.onBecomeLeader();
            }).thenReturn(sessionId),
            id -> awaitKey(key, entry -> !id.equals(entry.getSession())),
            id -> lose(key, listener),
            (id, err) -> lose(key, listener),
            id -> lose(key, listener));
    }

    private Mono<Void> follow(String key) {
        log.debug("Key {} held by another node, waiting for it to be released", key);
        // Consul refuses acquisition during the lock-delay that follows a release
        return awaitKey(key, entry -> !entry.isLocked())
            .then(Mono.delay(retryDelay))
            .then();
    }

    private Mono<Void> lose(String key, LeadershipListener listener) {
        log.warn("Leadership lost on {} by {}", key, nodeId);
        return listener.onLoseLeadership()
            .onErrorResume(err -> {
                log.error("Leadership loss handler failed: {}", err.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> awaitKey(String key, Predicate<KvEntry> condition) {
        AtomicReference<String> index = new AtomicReference<>();
        return Mono.defer(() -> catalog.watchKey(key, watchWait, index.get()))
            .doOnNext(entry -> index.set(entry.getIndex()))
            .repeat()
            .filter(condition)
            .next()
            .then();
    }

    private Mono<Void> destroy(String sessionId) {
        return catalog.destroySession(sessionId)
            .doOnSuccess(v -> log.debug("Session {} destroyed", sessionId))
            .onErrorResume(err -> {
                log.warn("Failed to destroy session {}: {}", sessionId, err.getMessage());
                return Mono.empty();
            });
    }
}

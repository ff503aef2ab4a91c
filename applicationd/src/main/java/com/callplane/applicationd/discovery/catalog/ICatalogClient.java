package com.callplane.applicationd.discovery.catalog;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Service catalog: registration, health checks, key/value store and sessions.
 * <p>
 * Write operations emit {@code false} when the catalog refuses the request and
 * signal a {@link CatalogException} when it cannot be reached.
 * </p>
 */
public interface ICatalogClient {

    Mono<Boolean> registerService(String serviceId, String name, String address, int port);

    Mono<Boolean> registerHealthCheck(String checkId, String serviceId, String httpUrl, Duration interval);

    Mono<Boolean> put(String key, String value);

    /**
     * @return the value, or an empty Mono if the key does not exist
     */
    Mono<String> get(String key);

    /**
     * Health of every instance of a service.
     *
     * @param serviceName service to query
     * @param wait        maximum time the catalog holds the request, null for an immediate answer
     * @param index       index returned by the previous query, null for an immediate answer
     * @return the new index and the full instance set
     */
    Mono<HealthServiceResult> healthService(String serviceName, Duration wait, String index);

    /**
     * Creates a session invalidated as soon as one of the given checks fails.
     *
     * @return the session id
     */
    Mono<String> createSession(String name, List<String> checks);

    Mono<Void> destroySession(String sessionId);

    /**
     * Takes the lock on a key for a session.
     *
     * @return true if the session now holds the lock
     */
    Mono<Boolean> acquire(String key, String value, String sessionId);

    Mono<Boolean> release(String key, String sessionId);

    /**
     * Blocking read of a key, returning when it changes or when {@code wait} elapses.
     */
    Mono<KvEntry> watchKey(String key, Duration wait, String index);
}

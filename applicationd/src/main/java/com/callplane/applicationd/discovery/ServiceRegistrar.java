package com.callplane.applicationd.discovery;

import com.callplane.applicationd.discovery.catalog.CatalogException;
import com.callplane.applicationd.discovery.catalog.ICatalogClient;
import com.callplane.core.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registers this process and its HTTP health check in the catalog.
 * <p>
 * Both registrations are retried together until they succeed in the same attempt.
 * Once they have, {@link #run()} is a no-op until {@link #restart()}.
 * </p>
 */
public class ServiceRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ServiceRegistrar.class);

    private final ICatalogClient catalog;
    private final String serviceId;
    private final String address;
    private final int port;
    private final String statusUrl;
    private final Duration checkInterval;
    private final Duration retryDelay;

    private final AtomicBoolean registered = new AtomicBoolean(false);

    public ServiceRegistrar(
        ICatalogClient catalog,
        String serviceId,
        String address,
        int port,
        String statusUrl,
        Duration checkInterval,
        Duration retryDelay
    ) {
        this.catalog = catalog;
        this.serviceId = serviceId;
        this.address = address;
        this.port = port;
        this.statusUrl = statusUrl;
        this.checkInterval = checkInterval;
        this.retryDelay = retryDelay;
    }

    public Mono<Void> run() {
        return Mono.defer(() -> {
            if (registered.get()) {
                log.debug("Service {} already registered", serviceId);
                return Mono.empty();
            }
            return Mono.defer(this::registerOnce)
                .retryWhen(RetryPolicy.fixedDelayForever(retryDelay, log, "Registration of " + serviceId))
                .doOnSuccess(v -> registered.set(true));
        });
    }

    /**
     * Forgets the previous registration and registers again.
     */
    public Mono<Void> restart() {
        return Mono.defer(() -> {
            registered.set(false);
            return run();
        });
    }

    public boolean isRegistered() {
        return registered.get();
    }

    /**
     * Identity of the health check, also the check an election session is bound to.
     */
    public String checkId() {
        return serviceId;
    }

    private Mono<Void> registerOnce() {
        return catalog.registerService(serviceId, serviceId, address, port)
            .flatMap(ok -> ok
                ? catalog.registerHealthCheck(checkId(), serviceId, statusUrl, checkInterval)
                : Mono.<Boolean>error(new CatalogException("registering service " + serviceId)))
            .flatMap(ok -> ok
                ? Mono.<Void>empty()
                : Mono.<Void>error(new CatalogException("registering check " + checkId())))
            .doOnSuccess(v -> log.info("Service check {} registered in catalog", checkId()));
    }
}

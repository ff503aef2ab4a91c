package com.callplane.applicationd.discovery.election;

import io.fabric8.kubernetes.api.model.coordination.v1.Lease;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseBuilder;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpec;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseSpecBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Leader election using the Kubernetes Lease API.
 * <p>
 * Every {@code retryInterval} the elector creates, renews or takes over an expired lease.
 * A lease is expired when it has not been renewed for {@code leaseDuration}. Catalog
 * health checks do not apply here: the lease expires on its own if the holder stops
 * renewing it.
 * </p>
 */
public class KubernetesLeaseElection implements ILeaderElection {
    private static final Logger log = LoggerFactory.getLogger(KubernetesLeaseElection.class);

    private final KubernetesClient client;
    private final String namespace;
    private final String identity;
    private final Duration leaseDuration;
    private final Duration retryInterval;

    public KubernetesLeaseElection(
        KubernetesClient client,
        String namespace,
        String identity,
        Duration leaseDuration,
        Duration retryInterval
    ) {
        this.client = client;
        this.namespace = namespace;
        this.identity = identity;
        this.leaseDuration = leaseDuration;
        this.retryInterval = retryInterval;

        log.info("Lease election initialized for {} in namespace {}", identity, namespace);
    }

    @Override
    public Mono<Void> startElection(String key, LeadershipListener listener, List<String> healthChecks) {
        String leaseName = toLeaseName(key);
        AtomicBoolean leader = new AtomicBoolean(false);

        return Mono.usingWhen(
            Mono.just(leader),
            state -> Flux.interval(Duration.ZERO, retryInterval)
                .onBackpressureDrop()
                .concatMap(tick -> Mono.fromCallable(() -> attempt(leaseName))
                    .subscribeOn(Schedulers.boundedElastic()), 1)
                .concatMap(acquired -> transition(leaseName, state, acquired, listener), 1)
                .then(),
            state -> stepDown(leaseName, state, listener),
            (state, err) -> stepDown(leaseName, state, listener),
            state -> stepDown(leaseName, state, listener));
    }

    @Override
    public void close() {
        client.close();
        log.info("Lease election stopped");
    }

    /**
     * Lease names must be valid DNS subdomains.
     */
    static String toLeaseName(String key) {
        return key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9.-]", "-");
    }

    private Mono<Void> transition(String leaseName, AtomicBoolean leader, boolean acquired, LeadershipListener listener) {
        boolean wasLeader = leader.getAndSet(acquired);
        if (acquired && !wasLeader) {
            log.info("Leadership ACQUIRED on lease {} by {}", leaseName, identity);
            return listener.onBecomeLeader();
        }
        if (!acquired && wasLeader) {
            log.warn("Leadership LOST on lease {} by {}", leaseName, identity);
            return listener.onLoseLeadership();
        }
        return Mono.empty();
    }

    private Mono<Void> stepDown(String leaseName, AtomicBoolean leader, LeadershipListener listener) {
        return Mono.defer(() -> {
            if (!leader.getAndSet(false)) {
                return Mono.empty();
            }
            return listener.onLoseLeadership()
                .then(Mono.fromRunnable(() -> release(leaseName)).subscribeOn(Schedulers.boundedElastic()))
                .then();
        });
    }

    boolean attempt(String leaseName) {
        try {
            Lease existingLease = client.leases()
                .inNamespace(namespace)
                .withName(leaseName)
                .get();

            if (existingLease == null) {
                return createLease(leaseName);
            }
            return acquireOrRenewLease(existingLease);
        } catch (Exception e) {
            log.error("Error during leader election attempt on {}: {}", leaseName, e.getMessage());
            return false;
        }
    }

    private boolean createLease(String leaseName) {
        try {
            ZonedDateTime now = now();

            Lease lease = new LeaseBuilder()
                .withNewMetadata()
                .withName(leaseName)
                .withNamespace(namespace)
                .endMetadata()
                .withSpec(newSpec(now))
                .build();

            client.leases()
                .inNamespace(namespace)
                .resource(lease)
                .create();
            return true;
        } catch (Exception e) {
            log.warn("Failed to create lease {} (another replica may have created it): {}", leaseName, e.getMessage());
            return false;
        }
    }

    private boolean acquireOrRenewLease(Lease existingLease) {
        LeaseSpec spec = existingLease.getSpec();
        String currentHolder = spec == null ? null : spec.getHolderIdentity();

        if (identity.equals(currentHolder)) {
            return update(existingLease, new LeaseSpecBuilder(spec).withRenewTime(now()).build());
        }

        Instant renewed = spec == null ? Instant.EPOCH : toInstant(spec.getRenewTime());
        if (Duration.between(renewed, Instant.now()).compareTo(leaseDuration) > 0) {
            log.info("Lease {} expired (held by {}), attempting takeover",
                existingLease.getMetadata().getName(), currentHolder);
            return update(existingLease, newSpec(now()));
        }

        log.debug("Lease {} held by {}", existingLease.getMetadata().getName(), currentHolder);
        return false;
    }

    private boolean update(Lease lease, LeaseSpec spec) {
        try {
            lease.setSpec(spec);
            client.leases()
                .inNamespace(namespace)
                .resource(lease)
                .update();
            return true;
        } catch (Exception e) {
            log.warn("Failed to update lease {}: {}", lease.getMetadata().getName(), e.getMessage());
            return false;
        }
    }

    private void release(String leaseName) {
        try {
            client.leases()
                .inNamespace(namespace)
                .withName(leaseName)
                .delete();
            log.info("Lease {} released by {}", leaseName, identity);
        } catch (Exception e) {
            log.warn("Failed to release lease {}: {}", leaseName, e.getMessage());
        }
    }

    private LeaseSpec newSpec(ZonedDateTime now) {
        return new LeaseSpecBuilder()
            .withHolderIdentity(identity)
            .withLeaseDurationSeconds((int) leaseDuration.toSeconds())
            .withAcquireTime(now)
            .withRenewTime(now)
            .build();
    }

    private static ZonedDateTime now() {
        return ZonedDateTime.now(ZoneOffset.UTC);
    }

    private static Instant toInstant(ZonedDateTime zonedDateTime) {
        if (zonedDateTime == null) {
            return Instant.EPOCH;
        }
        return zonedDateTime.toInstant();
    }
}

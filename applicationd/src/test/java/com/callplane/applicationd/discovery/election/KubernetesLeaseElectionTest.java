package com.callplane.applicationd.discovery.election;

import io.fabric8.kubernetes.api.model.coordination.v1.Lease;
import io.fabric8.kubernetes.api.model.coordination.v1.LeaseBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static com.callplane.applicationd.support.Await.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableKubernetesMockClient(crud = true)
class KubernetesLeaseElectionTest {

    private static final String NAMESPACE = "test";
    private static final String KEY = "service/applicationd/leader";

    KubernetesClient client;

    private KubernetesLeaseElection election(String identity) {
        return new KubernetesLeaseElection(client, NAMESPACE, identity, Duration.ofSeconds(15), Duration.ofMillis(100));
    }

    private Lease lease() {
        return client.leases().inNamespace(NAMESPACE).withName(KubernetesLeaseElection.toLeaseName(KEY)).get();
    }

    @Test
    void testToLeaseName_IsDnsCompatible() {
        assertEquals("service-applicationd-leader", KubernetesLeaseElection.toLeaseName(KEY));
    }

    @Test
    void testCreatesLeaseAndBecomesLeader() {
        RecordingListener listener = new RecordingListener();

        Disposable campaign = election("pod-a").startElection(KEY, listener, List.of()).subscribe();
        try {
            await(listener::isLeader);
            assertEquals("pod-a", lease().getSpec().getHolderIdentity());
            assertEquals(List.of("leader"), listener.transitions());
        } finally {
            campaign.dispose();
        }
    }

    @Test
    void testValidLeaseHeldByOther_NotLeader() throws InterruptedException {
        client.leases().inNamespace(NAMESPACE).resource(new LeaseBuilder()
            .withNewMetadata().withName(KubernetesLeaseElection.toLeaseName(KEY)).endMetadata()
            .withNewSpec()
            .withHolderIdentity("pod-b")
            .withLeaseDurationSeconds(15)
            .withRenewTime(ZonedDateTime.now(ZoneOffset.UTC))
            .endSpec()
            .build()).create();
        RecordingListener listener = new RecordingListener();

        Disposable campaign = election("pod-a").startElection(KEY, listener, List.of()).subscribe();
        try {
            Thread.sleep(400);
            assertTrue(listener.transitions().isEmpty());
            assertEquals("pod-b", lease().getSpec().getHolderIdentity());
        } finally {
            campaign.dispose();
        }
    }

    @Test
    void testExpiredLease_TakenOver() {
        client.leases().inNamespace(NAMESPACE).resource(new LeaseBuilder()
            .withNewMetadata().withName(KubernetesLeaseElection.toLeaseName(KEY)).endMetadata()
            .withNewSpec()
            .withHolderIdentity("pod-b")
            .withLeaseDurationSeconds(15)
            .withRenewTime(ZonedDateTime.now(ZoneOffset.UTC).minusMinutes(1))
            .endSpec()
            .build()).create();
        RecordingListener listener = new RecordingListener();

        Disposable campaign = election("pod-a").startElection(KEY, listener, List.of()).subscribe();
        try {
            await(listener::isLeader);
            assertEquals("pod-a", lease().getSpec().getHolderIdentity());
        } finally {
            campaign.dispose();
        }
    }

    @Test
    void testCancellation_ReleasesLease() {
        RecordingListener listener = new RecordingListener();
        Disposable campaign = election("pod-a").startElection(KEY, listener, List.of()).subscribe();
        await(listener::isLeader);

        campaign.dispose();

        await(() -> lease() == null);
        assertEquals(List.of("leader", "lost"), listener.transitions());
        assertFalse(listener.isLeader());
        assertNull(lease());
    }
}

package com.callplane.applicationd.discovery.election;

import com.callplane.applicationd.support.InMemoryCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.time.Duration;
import java.util.List;

import static com.callplane.applicationd.support.Await.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsulSessionElectionTest {

    private static final String KEY = "service/applicationd/leader";

    private InMemoryCatalog catalog;
    private final Disposable.Composite running = Disposables.composite();

    @BeforeEach
    void setUp() {
        catalog = new InMemoryCatalog();
    }

    @AfterEach
    void tearDown() {
        running.dispose();
    }

    private ConsulSessionElection election(String nodeId) {
        return election(nodeId, Duration.ofMillis(20));
    }

    private ConsulSessionElection election(String nodeId, Duration retryDelay) {
        return new ConsulSessionElection(catalog, nodeId, Duration.ofSeconds(30), retryDelay);
    }

    @Test
    void testSingleCandidate_BecomesLeader() {
        RecordingListener listener = new RecordingListener();

        running.add(election("node-a").startElection(KEY, listener, List.of("applicationd")).subscribe());

        await(listener::isLeader);
        assertEquals(List.of("leader"), listener.transitions());
        assertEquals("node-a", catalog.value(KEY));
        assertEquals(List.of("serfHealth", "applicationd"), catalog.sessionChecks().get(0));
    }

    @Test
    void testSecondCandidate_WaitsForLeader() throws InterruptedException {
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();

        running.add(election("node-a").startElection(KEY, first, List.of()).subscribe());
        await(first::isLeader);
        running.add(election("node-b").startElection(KEY, second, List.of()).subscribe());
        await(() -> catalog.sessions().size() == 2);
        Thread.sleep(100);

        assertTrue(second.transitions().isEmpty());
    }

    @Test
    void testSessionInvalidated_LeadershipMoves() {
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();
        // the deposed node retries slowly so that the follower wins the next round
        running.add(election("node-a", Duration.ofSeconds(1)).startElection(KEY, first, List.of()).subscribe());
        await(first::isLeader);
        String firstSession = catalog.lockHolder(KEY);
        running.add(election("node-b").startElection(KEY, second, List.of()).subscribe());
        await(() -> catalog.sessions().size() == 2);

        catalog.invalidateSession(firstSession);

        await(second::isLeader);
        await(() -> first.transitions().size() == 2);
        assertEquals(List.of("leader", "lost"), first.transitions());
        assertEquals("node-b", catalog.value(KEY));
    }

    @Test
    void testSoleCandidateSessionInvalidated_ElectedAgainWithNewSession() {
        RecordingListener listener = new RecordingListener();
        running.add(election("node-a").startElection(KEY, listener, List.of()).subscribe());
        await(listener::isLeader);
        String firstSession = catalog.lockHolder(KEY);

        catalog.invalidateSession(firstSession);

        await(() -> listener.transitions().size() == 3);
        assertEquals(List.of("leader", "lost", "leader"), listener.transitions());
        assertNotEquals(firstSession, catalog.lockHolder(KEY));
        assertEquals(1, catalog.sessions().size());
    }

    @Test
    void testCancellation_NotifiesLossAndDestroysSession() {
        RecordingListener listener = new RecordingListener();
        Disposable campaign = election("node-a").startElection(KEY, listener, List.of()).subscribe();
        await(listener::isLeader);

        campaign.dispose();

        await(() -> catalog.sessions().isEmpty());
        assertEquals(List.of("leader", "lost"), listener.transitions());
        assertNull(catalog.lockHolder(KEY));
        assertFalse(listener.isLeader());
    }
}

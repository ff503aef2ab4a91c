package com.callplane.applicationd.bus;

import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.core.msg.OutboundEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static com.callplane.applicationd.support.Await.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BusSupervisorTest {

    private static final Duration RECONNECTION_RATE = Duration.ofMillis(50);

    private DispatchRegistry registry;
    private OutboundQueue outbound;
    private MetricsService metrics;
    private List<String> handled;
    private Disposable running;

    @BeforeEach
    void setUp() {
        registry = new DispatchRegistry();
        outbound = new OutboundQueue();
        metrics = new MetricsService(new SimpleMeterRegistry());
        handled = new CopyOnWriteArrayList<>();
        registry.register("StasisStart", (context, event, payload) ->
            Mono.fromRunnable(() -> handled.add(context.getAsteriskId())));
    }

    @AfterEach
    void tearDown() {
        if (running != null) {
            running.dispose();
        }
    }

    private BusSupervisor supervisor(TestBrokerConnector connector) {
        return new BusSupervisor(
            connector,
            new BusConsumer(registry, metrics),
            new BusProducer(metrics),
            outbound,
            RECONNECTION_RATE,
            metrics);
    }

    @Test
    void testReconnect_SucceedsAfterFailures() {
        TestBrokerConnector connector = new TestBrokerConnector(3);
        BusSupervisor supervisor = supervisor(connector);

        running = supervisor.run().subscribe();

        await(() -> supervisor.activePairs() == 1);
        assertEquals(4, connector.attempts());
        assertEquals(1, supervisor.generation());
        assertEquals(1, connector.sessions().size());
    }

    @Test
    void testDeliveredMessagesReachHandlers() {
        TestBrokerConnector connector = new TestBrokerConnector(0);
        BusSupervisor supervisor = supervisor(connector);
        running = supervisor.run().subscribe();
        await(() -> supervisor.activePairs() == 1);

        TestMessage message = new TestMessage("{\"type\":\"StasisStart\",\"asterisk_id\":\"ast-1\",\"application\":\"myapp\"}");
        connector.last().deliver(message);

        await(() -> handled.size() == 1);
        assertEquals(1, message.acks());
    }

    @Test
    void testConnectionLoss_StartsNewGeneration() {
        TestBrokerConnector connector = new TestBrokerConnector(0);
        BusSupervisor supervisor = supervisor(connector);
        running = supervisor.run().subscribe();
        await(() -> supervisor.activePairs() == 1);

        TestBrokerSession first = connector.last();
        first.kill();

        await(() -> supervisor.generation() == 2 && supervisor.activePairs() == 1);
        assertTrue(first.isInboundCancelled());
        assertTrue(first.isCloseCalled());
        assertEquals(1, supervisor.activePairs());

        // the dead generation no longer dispatches
        first.deliver(new TestMessage("{\"type\":\"StasisStart\",\"asterisk_id\":\"old\",\"application\":\"myapp\"}"));
        connector.last().deliver(new TestMessage("{\"type\":\"StasisStart\",\"asterisk_id\":\"new\",\"application\":\"myapp\"}"));

        await(() -> handled.contains("new"));
        assertEquals(List.of("new"), handled);
    }

    @Test
    void testEventsQueuedWhileDisconnected_PublishedInOrder() {
        outbound.offer(event("A"));
        outbound.offer(event("B"));
        TestBrokerConnector connector = new TestBrokerConnector(2);
        BusSupervisor supervisor = supervisor(connector);

        running = supervisor.run().subscribe();
        await(() -> supervisor.activePairs() == 1);
        outbound.offer(event("C"));

        TestBrokerSession session = connector.last();
        await(() -> session.published().size() == 3);
        assertEquals(List.of("A", "B", "C"), routingKeys(session.published()));
    }

    @Test
    void testCancellation_ClosesLiveConnection() {
        TestBrokerConnector connector = new TestBrokerConnector(0);
        BusSupervisor supervisor = supervisor(connector);
        running = supervisor.run().subscribe();
        await(() -> supervisor.activePairs() == 1);

        running.dispose();

        assertTrue(connector.last().isCloseCalled());
        assertEquals(0, supervisor.activePairs());
    }

    @Test
    void testCancellationDuringConnect_ClosesLateSession() {
        TestBrokerConnector connector = new TestBrokerConnector(0, Duration.ofMillis(300));
        BusSupervisor supervisor = supervisor(connector);
        running = supervisor.run().subscribe();
        await(() -> connector.attempts() == 1);

        running.dispose();

        await(() -> connector.sessions().size() == 1);
        await(() -> connector.last().isCloseCalled());
        assertEquals(0, supervisor.generation());
        assertEquals(0, supervisor.activePairs());
    }

    private static OutboundEvent event(String routingKey) {
        return OutboundEvent.builder()
            .name("event-" + routingKey)
            .body("payload")
            .routingKey(routingKey)
            .build();
    }

    private static List<String> routingKeys(List<TransportMessage> messages) {
        return messages.stream().map(TransportMessage::getRoutingKey).collect(Collectors.toList());
    }
}

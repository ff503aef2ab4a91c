package com.callplane.applicationd.bus;

import com.callplane.core.msg.OutboundEvent;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OutboundQueueTest {

    @Test
    void testOfferNeverBlocksWithoutConsumer() {
        OutboundQueue queue = new OutboundQueue();

        for (int i = 0; i < 10_000; i++) {
            queue.offer(event("k" + i));
        }

        assertEquals(10_000, queue.size());
    }

    @Test
    void testDrain_PreservesEnqueueOrder() {
        OutboundQueue queue = new OutboundQueue();
        queue.offer(event("A"));
        queue.offer(event("B"));

        StepVerifier.create(queue.drain().map(OutboundEvent::getRoutingKey))
            .expectNext("A", "B")
            .then(() -> queue.offer(event("C")))
            .expectNext("C")
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void testDrain_OnlyPollsWhatIsRequested() {
        OutboundQueue queue = new OutboundQueue();
        queue.offer(event("A"));
        queue.offer(event("B"));
        queue.offer(event("C"));

        StepVerifier.create(queue.drain().map(OutboundEvent::getRoutingKey), 1)
            .expectNext("A")
            .thenCancel()
            .verify(Duration.ofSeconds(5));

        // events not handed out stay for the next generation
        StepVerifier.create(queue.drain().map(OutboundEvent::getRoutingKey))
            .expectNext("B", "C")
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }

    private static OutboundEvent event(String routingKey) {
        return OutboundEvent.builder().name(routingKey).routingKey(routingKey).build();
    }
}

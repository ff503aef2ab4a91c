package com.callplane.applicationd.bus;

import com.callplane.core.msg.OutboundEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Long-lived outbound channel shared by every connection generation.
 * <p>
 * {@link #offer} never blocks: events pile up while the broker is unreachable and
 * are drained by the producer of the next generation. The queue is unbounded.
 * </p>
 * <p>
 * {@link #drain()} may be subscribed many times over the life of the process, but
 * by one producer at a time.
 * </p>
 */
public class OutboundQueue {

    private final Queue<OutboundEvent> pending = new ConcurrentLinkedQueue<>();
    private final Sinks.Many<Boolean> wakeups = Sinks.many().multicast().directBestEffort();

    public void offer(OutboundEvent event) {
        pending.add(event);
        // a concurrent emitter is draining anyway, retry only on serialization conflicts
        while (wakeups.tryEmitNext(Boolean.TRUE) == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            Thread.onSpinWait();
        }
    }

    /**
     * Events in enqueue order. Each event is polled from the queue only when the
     * subscriber requests it.
     */
    public Flux<OutboundEvent> drain() {
        return Flux.merge(wakeups.asFlux(), Mono.just(Boolean.TRUE))
            .onBackpressureLatest()
            .concatMap(tick -> pollAvailable(), 1);
    }

    public int size() {
        return pending.size();
    }

    private Flux<OutboundEvent> pollAvailable() {
        return Flux.generate(sink -> {
            OutboundEvent next = pending.poll();
            if (next == null) {
                sink.complete();
            } else {
                sink.next(next);
            }
        });
    }
}

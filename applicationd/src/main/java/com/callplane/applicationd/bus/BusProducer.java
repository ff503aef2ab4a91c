package com.callplane.applicationd.bus;

import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.core.msg.OutboundEvent;
import com.callplane.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Outbound pipeline: serializes queued events and publishes them in order.
 * <p>
 * Publishing is fire-and-forget. A broken connection is detected by the
 * {@link BusSupervisor}, which replaces this pipeline with a new one.
 * </p>
 */
public class BusProducer {
    private static final Logger log = LoggerFactory.getLogger(BusProducer.class);

    private final MetricsService metrics;

    public BusProducer(MetricsService metrics) {
        this.metrics = metrics;
    }

    /**
     * Publishes every event of the source on the session.
     *
     * @param events  outbound events in enqueue order
     * @param session live broker session of the current generation
     * @return Mono completing when the source completes
     */
    public Mono<Void> produce(Flux<OutboundEvent> events, BrokerSession session) {
        Flux<TransportMessage> messages = events
            .<TransportMessage>handle((event, sink) -> {
                try {
                    sink.next(toMessage(event));
                } catch (IllegalArgumentException e) {
                    log.error("Dropping event \"{}\": {}", event.getName(), e.getMessage());
                }
            })
            .doOnNext(message -> metrics.recordPublished());

        return session.publish(messages);
    }

    TransportMessage toMessage(OutboundEvent event) {
        TransportMessage message = new TransportMessage(event.getRoutingKey(), event.getMetadata(), serialize(event.getBody()));
        log.debug("Publishing event \"{}\" with routing key {}", event.getName(), event.getRoutingKey());
        return message;
    }

    private static byte[] serialize(Object body) {
        if (body == null) {
            return new byte[0];
        }
        if (body instanceof byte[]) {
            return (byte[]) body;
        }
        if (body instanceof String) {
            return ((String) body).getBytes(StandardCharsets.UTF_8);
        }
        return JsonUtils.writeValueAsBytes(body);
    }
}

package com.callplane.applicationd.bus;

import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.core.msg.OutboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Wires the dispatch registry, the outbound queue and the connection supervisor.
 */
public class BusService implements IBusService {
    private static final Logger log = LoggerFactory.getLogger(BusService.class);

    private final DispatchRegistry registry = new DispatchRegistry();
    private final OutboundQueue outbound = new OutboundQueue();
    private final BusSupervisor supervisor;

    public BusService(BrokerConnector connector, Duration reconnectionRate, MetricsService metrics) {
        this.supervisor = new BusSupervisor(
            connector,
            new BusConsumer(registry, metrics),
            new BusProducer(metrics),
            outbound,
            reconnectionRate,
            metrics
        );
    }

    @Override
    public Mono<Void> run() {
        return Mono.defer(() -> {
            log.info("Start AMQP bus with {} event handler(s)", registry.size());
            return supervisor.run();
        });
    }

    @Override
    public void publish(OutboundEvent event) {
        outbound.offer(event);
    }

    @Override
    public void onEvent(String type, StasisEventHandler handler) {
        registry.register(type, handler);
    }

    public BusSupervisor getSupervisor() {
        return supervisor;
    }

    public int pendingEvents() {
        return outbound.size();
    }
}

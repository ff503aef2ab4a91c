package com.callplane.applicationd.metrics;

import com.callplane.core.metrics.MetricsNames;
import com.callplane.core.metrics.MetricsTags;
import com.callplane.core.model.NodeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Locale;

/**
 * Counters for the bus pipelines and the node watch.
 */
public class MetricsService {

    private final MeterRegistry registry;

    private final Counter consumed;
    private final Counter published;
    private final Counter connectSuccess;
    private final Counter connectFailure;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;

        consumed = Counter.builder(MetricsNames.BUS_CONSUMED_TOTAL)
            .description("Inbound messages taken from the dispatcher queue")
            .register(registry);

        published = Counter.builder(MetricsNames.BUS_PUBLISHED_TOTAL)
            .description("Outbound events handed to the broker")
            .register(registry);

        connectSuccess = Counter.builder(MetricsNames.BUS_CONNECT_TOTAL)
            .tag(MetricsTags.OUTCOME, "success")
            .description("Broker connection attempts")
            .register(registry);

        connectFailure = Counter.builder(MetricsNames.BUS_CONNECT_TOTAL)
            .tag(MetricsTags.OUTCOME, "failure")
            .description("Broker connection attempts")
            .register(registry);
    }

    public void recordConsumed() {
        consumed.increment();
    }

    public void recordPublished() {
        published.increment();
    }

    public void recordConnect(boolean success) {
        (success ? connectSuccess : connectFailure).increment();
    }

    public void recordDropped(String reason) {
        registry.counter(MetricsNames.BUS_DROPPED_TOTAL, MetricsTags.REASON, reason).increment();
    }

    public void recordDispatched(String type) {
        registry.counter(MetricsNames.BUS_DISPATCHED_TOTAL, MetricsTags.TYPE, type).increment();
    }

    public void recordNodeTransition(NodeStatus status) {
        registry.counter(MetricsNames.DISCOVERY_NODE_TRANSITIONS_TOTAL,
            MetricsTags.STATUS, status.name().toLowerCase(Locale.ROOT)).increment();
    }

    public double droppedCount(String reason) {
        Counter counter = registry.find(MetricsNames.BUS_DROPPED_TOTAL).tag(MetricsTags.REASON, reason).counter();
        return counter == null ? 0 : counter.count();
    }
}

package com.callplane.applicationd.metrics;

import com.callplane.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes the dispatcher counters, together with reactor-netty's own HTTP client and
 * server meters, in Prometheus text format for {@code GET /metrics}.
 * <p>
 * Every meter carries the {@code node_id} of this replica so that the leader and the
 * followers can be told apart on a shared dashboard.
 * </p>
 */
public class PrometheusMetricsExporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    static final String SERVICE_TAG = "service";
    static final String SERVICE_NAME = "applicationd";

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry scrapeRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.scrapeRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        attach();

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId, SERVICE_TAG, SERVICE_NAME);
        log.info("Prometheus scrape registry attached for node {}", nodeId);
    }

    private void attach() {
        if (registry instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) registry).add(scrapeRegistry);
        } else {
            log.warn("Global registry is a {}, /metrics will stay empty", registry.getClass().getSimpleName());
        }
    }

    public String scrape() {
        return scrapeRegistry.scrape();
    }

    /**
     * Detaches the scrape registry from the global one. Meters keep counting, they are
     * just no longer exported.
     */
    @Override
    public void close() {
        if (registry instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) registry).remove(scrapeRegistry);
        }
        scrapeRegistry.close();
        log.info("Prometheus scrape registry detached");
    }
}

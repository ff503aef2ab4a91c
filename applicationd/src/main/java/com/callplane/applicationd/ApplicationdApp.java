package com.callplane.applicationd;

import com.callplane.applicationd.bus.BusService;
import com.callplane.applicationd.bus.rabbit.RabbitBrokerConnector;
import com.callplane.applicationd.config.ApplicationdConfig;
import com.callplane.applicationd.discovery.DiscoveryService;
import com.callplane.applicationd.discovery.catalog.ConsulCatalogClient;
import com.callplane.applicationd.discovery.catalog.ICatalogClient;
import com.callplane.applicationd.discovery.election.ConsulSessionElection;
import com.callplane.applicationd.discovery.election.ILeaderElection;
import com.callplane.applicationd.discovery.election.KubernetesLeaseElection;
import com.callplane.applicationd.http.HttpServer;
import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.applicationd.metrics.PrometheusMetricsExporter;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Main entry point for the call-control dispatcher.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Consume call-control events from the AMQP bus and dispatch them by type</li>
 *   <li>Publish outbound events on the bus</li>
 *   <li>Register in the service catalog with an HTTP health check</li>
 *   <li>Watch Asterisk node health while leader</li>
 *   <li>Expose /status and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class ApplicationdApp {
    private static final Logger log = LoggerFactory.getLogger(ApplicationdApp.class);

    private static final Duration LEASE_DURATION = Duration.ofSeconds(15);
    private static final Duration LEASE_RETRY_INTERVAL = Duration.ofSeconds(5);

    public static void main(String[] args) {
        ApplicationdConfig config = ApplicationdConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting applicationd node: {}", config.getNodeId());
        log.info("  AMQP: {}:{} exchange {}", config.getAmqpHost(), config.getAmqpPort(), config.getAmqpExchange());
        log.info("  Consul: {}:{}", config.getConsulHost(), config.getConsulPort());
        log.info("  Leader election: {}", config.getLeaderElection());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry());

        HttpServer httpServer = new HttpServer(config, metricsExporter);
        httpServer.start();

        BusService busService = new BusService(
            new RabbitBrokerConnector(config), config.getAmqpReconnectionRate(), metricsService);

        ICatalogClient catalog = new ConsulCatalogClient(config.getConsulHost(), config.getConsulPort());
        ILeaderElection election = createElection(config, catalog);
        DiscoveryService discoveryService = new DiscoveryService(config, catalog, election, metricsService);

        discoveryService.onNodeOK(node -> Mono.fromRunnable(() ->
            log.info("Asterisk {} available at {}:{}", node.getId(), node.getAddress(), node.getPort())));
        discoveryService.onNodeKO(node -> Mono.fromRunnable(() ->
            log.warn("Asterisk {} unavailable at {}:{}", node.getId(), node.getAddress(), node.getPort())));

        Disposable bus = busService.run()
            .subscribe(null, err -> log.error("AMQP bus stopped: {}", err.getMessage(), err));
        Disposable discovery = discoveryService.run()
            .subscribe(null, err -> log.error("Discovery stopped: {}", err.getMessage(), err));

        log.info("applicationd node {} is ready", config.getNodeId());

        handleShutdown(config, httpServer, metricsExporter, election, bus, discovery);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    static ILeaderElection createElection(ApplicationdConfig config, ICatalogClient catalog) {
        if ("kubernetes".equalsIgnoreCase(config.getLeaderElection())) {
            return new KubernetesLeaseElection(
                new KubernetesClientBuilder().build(),
                config.getKubernetesNamespace(),
                config.getNodeId(),
                LEASE_DURATION,
                LEASE_RETRY_INTERVAL);
        }
        return new ConsulSessionElection(
            catalog, config.getNodeId(), config.getWatchWait(), config.getRegistrationRetry());
    }

    private static void handleShutdown(ApplicationdConfig config,
                                       HttpServer httpServer,
                                       PrometheusMetricsExporter metricsExporter,
                                       ILeaderElection election,
                                       Disposable bus,
                                       Disposable discovery) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            discovery.dispose();
            bus.dispose();
            election.close();
            httpServer.stop();
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}

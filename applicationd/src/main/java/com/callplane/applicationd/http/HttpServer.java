package com.callplane.applicationd.http;

import com.callplane.applicationd.config.ApplicationdConfig;
import com.callplane.applicationd.metrics.PrometheusMetricsExporter;
import com.callplane.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP endpoints: {@code /status} for the catalog health check and {@code /metrics}
 * for Prometheus.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final ApplicationdConfig config;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(ApplicationdConfig config, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.metricsExporter = metricsExporter;
    }

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/status", (req, res) -> {
                Map<String, Object> status = new LinkedHashMap<>();
                status.put("status", "ok");
                status.put("node_id", config.getNodeId());
                return res.header("Content-Type", "application/json")
                    .sendString(Mono.just(JsonUtils.writeValueAsString(status)));
            })
            .get("/metrics", (req, res) ->
                res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.fromCallable(metricsExporter::scrape))
            );
    }
}

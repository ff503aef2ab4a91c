package com.callplane.applicationd.http;

import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.applicationd.metrics.PrometheusMetricsExporter;
import com.callplane.applicationd.support.TestConfigs;
import com.callplane.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpServerTest {

    private PrometheusMetricsExporter exporter;
    private HttpServer httpServer;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        exporter = new PrometheusMetricsExporter("applicationd-test");
        new MetricsService(exporter.getRegistry()).recordConsumed();

        httpServer = new HttpServer(TestConfigs.config(), exporter);
        DisposableServer server = httpServer.start();
        client = HttpClient.create().port(server.port());
    }

    @AfterEach
    void tearDown() {
        httpServer.stop();
        exporter.close();
    }

    @Test
    void testStatus_ReportsNodeId() {
        String body = client.get().uri("/status")
            .responseContent().aggregate().asString()
            .block(Duration.ofSeconds(5));

        JsonNode status = JsonUtils.readTree(body.getBytes(StandardCharsets.UTF_8));
        assertEquals("ok", status.get("status").asText());
        assertEquals("applicationd-test", status.get("node_id").asText());
    }

    @Test
    void testMetrics_PrometheusFormat() {
        String body = client.get().uri("/metrics")
            .responseContent().aggregate().asString()
            .block(Duration.ofSeconds(5));

        assertTrue(body.contains("callplane_bus_consumed_total"));
        assertTrue(body.contains("node_id=\"applicationd-test\""));
        assertTrue(body.contains("service=\"applicationd\""));
    }
}

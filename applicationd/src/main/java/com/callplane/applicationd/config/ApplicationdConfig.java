package com.callplane.applicationd.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the application dispatcher, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ApplicationdConfig {

    String nodeId;

    // Address advertised in the catalog and used by its health check
    String host;
    int httpPort;

    // Broker
    String amqpHost;
    int amqpPort;
    String amqpUsername;
    String amqpPassword;
    String amqpExchange;          // call-control events are consumed from here
    String amqpRoutingKey;        // binding of the dispatcher queue
    String amqpPublishExchange;   // outbound events go here
    Duration amqpReconnectionRate;

    // Catalog
    String consulHost;
    int consulPort;
    Duration registrationRetry;
    Duration healthCheckInterval;

    // Node watch
    String asteriskServiceName;
    Duration watchWait;
    Duration watchPrimingRetry;

    // Leader election
    String electionKey;
    String leaderElection;        // consul | kubernetes
    String kubernetesNamespace;

    public static ApplicationdConfig fromEnv() {
        return ApplicationdConfig.builder()
            .nodeId(getEnv("NODE_ID", "applicationd-1"))
            .host(getEnv("HOST", "localhost"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8000")))
            .amqpHost(getEnv("AMQP_HOST", "localhost"))
            .amqpPort(Integer.parseInt(getEnv("AMQP_PORT", "5672")))
            .amqpUsername(getEnv("AMQP_USERNAME", "guest"))
            .amqpPassword(getEnv("AMQP_PASSWORD", "guest"))
            .amqpExchange(getEnv("AMQP_EXCHANGE", "call-control"))
            .amqpRoutingKey(getEnv("AMQP_ROUTING_KEY", "#"))
            .amqpPublishExchange(getEnv("AMQP_PUBLISH_EXCHANGE", "applicationd"))
            .amqpReconnectionRate(Duration.ofSeconds(Integer.parseInt(getEnv("AMQP_RECONNECTION_RATE_SEC", "1"))))
            .consulHost(getEnv("CONSUL_HOST", "localhost"))
            .consulPort(Integer.parseInt(getEnv("CONSUL_PORT", "8500")))
            .registrationRetry(Duration.ofSeconds(Integer.parseInt(getEnv("REGISTRATION_RETRY_SEC", "5"))))
            .healthCheckInterval(Duration.ofSeconds(Integer.parseInt(getEnv("HEALTH_CHECK_INTERVAL_SEC", "5"))))
            .asteriskServiceName(getEnv("ASTERISK_SERVICE_NAME", "asterisk"))
            .watchWait(Duration.ofSeconds(Integer.parseInt(getEnv("WATCH_WAIT_SEC", "30"))))
            .watchPrimingRetry(Duration.ofSeconds(Integer.parseInt(getEnv("WATCH_PRIMING_RETRY_SEC", "5"))))
            .electionKey(getEnv("ELECTION_KEY", "service/applicationd/leader"))
            .leaderElection(getEnv("LEADER_ELECTION", "consul"))
            .kubernetesNamespace(getEnv("KUBERNETES_NAMESPACE", "default"))
            .build();
    }

    /**
     * URL the catalog polls to decide whether this process is alive.
     */
    public String statusUrl() {
        return String.format("http://%s:%d/status", host, httpPort);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}

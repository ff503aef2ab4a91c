package com.callplane.applicationd.support;

import com.callplane.applicationd.config.ApplicationdConfig;

import java.time.Duration;

public final class TestConfigs {
    private TestConfigs() {
    }

    public static ApplicationdConfig config() {
        return ApplicationdConfig.builder()
            .nodeId("applicationd-test")
            .host("10.0.0.5")
            .httpPort(0)
            .amqpHost("localhost")
            .amqpPort(5672)
            .amqpUsername("guest")
            .amqpPassword("guest")
            .amqpExchange("call-control")
            .amqpRoutingKey("#")
            .amqpPublishExchange("applicationd")
            .amqpReconnectionRate(Duration.ofMillis(50))
            .consulHost("localhost")
            .consulPort(8500)
            .registrationRetry(Duration.ofMillis(20))
            .healthCheckInterval(Duration.ofSeconds(5))
            .asteriskServiceName("asterisk")
            .watchWait(Duration.ofSeconds(30))
            .watchPrimingRetry(Duration.ofMillis(20))
            .electionKey("service/applicationd/leader")
            .leaderElection("consul")
            .kubernetesNamespace("default")
            .build();
    }
}

package com.callplane.applicationd.bus.rabbit;

import com.callplane.applicationd.bus.BrokerConnector;
import com.callplane.applicationd.bus.BrokerSession;
import com.callplane.applicationd.config.ApplicationdConfig;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Opens RabbitMQ connections with the AMQP client and hands them to reactor-rabbitmq.
 * <p>
 * Automatic recovery of the AMQP client is turned off: reconnecting is the job of
 * the bus supervisor, which also restarts the pipelines.
 * </p>
 */
public class RabbitBrokerConnector implements BrokerConnector {
    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerConnector.class);

    private final ApplicationdConfig config;
    private final ConnectionFactory factory;

    public RabbitBrokerConnector(ApplicationdConfig config) {
        this.config = config;
        this.factory = new ConnectionFactory();
        factory.setHost(config.getAmqpHost());
        factory.setPort(config.getAmqpPort());
        factory.setUsername(config.getAmqpUsername());
        factory.setPassword(config.getAmqpPassword());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        log.info("RabbitMQ connector targeting {}:{} as {}", config.getAmqpHost(), config.getAmqpPort(), config.getAmqpUsername());
    }

    @Override
    public Mono<BrokerSession> connect() {
        return Mono.fromCallable(() -> factory.newConnection(config.getNodeId()))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(connection -> RabbitBrokerSession.open(connection, config)
                .onErrorResume(err -> {
                    closeQuietly(connection);
                    return Mono.error(err);
                }));
    }

    static void closeQuietly(Connection connection) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close();
        } catch (Exception e) {
            log.debug("Ignoring error while closing broker connection: {}", e.getMessage());
        }
    }
}

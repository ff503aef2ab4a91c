package com.callplane.applicationd.bus.rabbit;

import com.callplane.applicationd.bus.BrokerSession;
import com.callplane.applicationd.bus.InboundMessage;
import com.callplane.applicationd.bus.TransportMessage;
import com.callplane.applicationd.config.ApplicationdConfig;
import com.callplane.core.msg.Exchanges;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.rabbitmq.AcknowledgableDelivery;
import reactor.rabbitmq.BindingSpecification;
import reactor.rabbitmq.ExchangeSpecification;
import reactor.rabbitmq.OutboundMessage;
import reactor.rabbitmq.QueueSpecification;
import reactor.rabbitmq.RabbitFlux;
import reactor.rabbitmq.Receiver;
import reactor.rabbitmq.ReceiverOptions;
import reactor.rabbitmq.Sender;
import reactor.rabbitmq.SenderOptions;

import java.util.HashMap;
import java.util.Map;

/**
 * A RabbitMQ connection with its reactor-rabbitmq sender and receiver.
 * <p>
 * Topology: the dispatcher queue is bound to the call-control topic exchange with
 * the configured routing key; outbound events go to a separate topic exchange.
 * </p>
 */
class RabbitBrokerSession implements BrokerSession {
    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerSession.class);

    private final Connection connection;
    private final Sender sender;
    private final Receiver receiver;
    private final String publishExchange;
    private final Sinks.Empty<Void> closed = Sinks.empty();

    private RabbitBrokerSession(Connection connection, ApplicationdConfig config) {
        this.connection = connection;
        this.publishExchange = config.getAmqpPublishExchange();

        Mono<Connection> connectionMono = Mono.just(connection);
        this.sender = RabbitFlux.createSender(new SenderOptions().connectionMono(connectionMono));
        this.receiver = RabbitFlux.createReceiver(new ReceiverOptions().connectionMono(connectionMono));

        connection.addShutdownListener(cause -> {
            if (cause.isInitiatedByApplication()) {
                log.info("Broker connection closed");
            } else {
                log.error("Connection lost while consuming queue: {}", cause.getMessage());
            }
            closed.tryEmitEmpty();
        });
    }

    static Mono<BrokerSession> open(Connection connection, ApplicationdConfig config) {
        RabbitBrokerSession session = new RabbitBrokerSession(connection, config);
        return session.declareTopology(config).thenReturn(session);
    }

    private Mono<Void> declareTopology(ApplicationdConfig config) {
        String exchange = config.getAmqpExchange();
        return sender.declareExchange(ExchangeSpecification.exchange(exchange).type(Exchanges.EXCHANGE_TYPE))
            .then(sender.declareQueue(QueueSpecification.queue(Exchanges.DISPATCHER_QUEUE)))
            .then(sender.bind(BindingSpecification.binding(exchange, config.getAmqpRoutingKey(), Exchanges.DISPATCHER_QUEUE)))
            .then(sender.declareExchange(ExchangeSpecification.exchange(publishExchange).type(Exchanges.EXCHANGE_TYPE)))
            .doOnSuccess(ok -> log.info("Queue {} bound to {} with {}, publishing on {}",
                Exchanges.DISPATCHER_QUEUE, exchange, config.getAmqpRoutingKey(), publishExchange))
            .then();
    }

    @Override
    public Flux<InboundMessage> inbound() {
        return receiver.consumeManualAck(Exchanges.DISPATCHER_QUEUE)
            .map(DeliveryMessage::new);
    }

    @Override
    public Mono<Void> publish(Flux<TransportMessage> messages) {
        return sender.send(messages.map(this::toOutbound));
    }

    @Override
    public Mono<Void> closed() {
        return closed.asMono();
    }

    @Override
    public void close() {
        try {
            receiver.close();
            sender.close();
        } finally {
            RabbitBrokerConnector.closeQuietly(connection);
        }
    }

    private OutboundMessage toOutbound(TransportMessage message) {
        Map<String, Object> headers = new HashMap<>(message.getHeaders());
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
            .contentType(Exchanges.CONTENT_TYPE_JSON)
            .headers(headers)
            .build();
        return new OutboundMessage(publishExchange, message.getRoutingKey(), properties, message.getBody());
    }

    private static final class DeliveryMessage implements InboundMessage {
        private final AcknowledgableDelivery delivery;

        private DeliveryMessage(AcknowledgableDelivery delivery) {
            this.delivery = delivery;
        }

        @Override
        public byte[] body() {
            return delivery.getBody();
        }

        @Override
        public void ack() {
            delivery.ack();
        }
    }
}

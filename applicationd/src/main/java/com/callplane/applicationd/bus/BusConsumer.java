package com.callplane.applicationd.bus;

import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.core.model.Application;
import com.callplane.core.msg.Context;
import com.callplane.core.msg.Exchanges;
import com.callplane.core.msg.StasisEvent;
import com.callplane.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Inbound pipeline: decodes bus messages and routes them to the registered handlers.
 * <p>
 * Messages are processed one at a time in arrival order. Each message is
 * acknowledged as soon as it is dequeued, so a message that fails later is not
 * redelivered. A slow handler slows consumption down.
 * </p>
 */
public class BusConsumer {
    private static final Logger log = LoggerFactory.getLogger(BusConsumer.class);

    static final String DROP_DECODE_ERROR = "decode_error";
    static final String DROP_MISSING_TYPE = "missing_type";
    static final String DROP_MISSING_ASTERISK_ID = "missing_asterisk_id";
    static final String DROP_INVALID_APPLICATION = "invalid_application";
    static final String DROP_UNHANDLED_TYPE = "unhandled_type";
    static final String DROP_HANDLER_ERROR = "handler_error";
    static final String DROP_ACK_FAILED = "ack_failed";

    private final DispatchRegistry registry;
    private final MetricsService metrics;

    public BusConsumer(DispatchRegistry registry, MetricsService metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    /**
     * Consumes the inbound flux until it terminates or the subscription is disposed.
     *
     * @param inbound deliveries of one connection generation
     * @return Mono completing when the inbound flux completes
     */
    public Mono<Void> consume(Flux<InboundMessage> inbound) {
        return inbound
            .concatMap(this::process, 1)
            .then();
    }

    Mono<Void> process(InboundMessage message) {
        try {
            message.ack();
        } catch (RuntimeException e) {
            // channel is gone, the broker will redeliver this message to the next generation
            log.error("Failed to acknowledge bus message: {}", e.getMessage());
            metrics.recordDropped(DROP_ACK_FAILED);
            return Mono.empty();
        }
        metrics.recordConsumed();

        JsonNode document;
        try {
            document = JsonUtils.readTree(message.body());
        } catch (UncheckedIOException e) {
            log.error("Error while decoding bus message: {}", e.getCause().getMessage());
            metrics.recordDropped(DROP_DECODE_ERROR);
            return Mono.empty();
        }
        if (document == null || !document.isObject()) {
            log.error("Error while decoding bus message: not a JSON object");
            metrics.recordDropped(DROP_DECODE_ERROR);
            return Mono.empty();
        }

        String type = text(document.path(Exchanges.FIELD_TYPE));
        if (type == null) {
            metrics.recordDropped(DROP_MISSING_TYPE);
            return Mono.empty();
        }

        String asteriskId = text(document.path(Exchanges.FIELD_ASTERISK_ID));
        if (asteriskId == null) {
            log.error("Error message without asterisk id: {}", document);
            metrics.recordDropped(DROP_MISSING_ASTERISK_ID);
            return Mono.empty();
        }

        String applicationName = resolveApplicationName(document);
        if (!Application.isValid(applicationName)) {
            log.error("Error not a valid application: {}", document);
            metrics.recordDropped(DROP_INVALID_APPLICATION);
            return Mono.empty();
        }

        Optional<StasisEventHandler> handler = registry.lookup(type);
        if (handler.isEmpty()) {
            metrics.recordDropped(DROP_UNHANDLED_TYPE);
            return Mono.empty();
        }

        Context context = new Context(asteriskId);
        StasisEvent event = new StasisEvent(asteriskId, applicationName);
        metrics.recordDispatched(type);
        log.debug("Dispatching {} from {} for application {}", type, asteriskId, applicationName);

        return Mono.defer(() -> handler.get().handle(context, event, document))
            .onErrorResume(err -> {
                log.error("Handler for {} failed: {}", type, err.getMessage(), err);
                metrics.recordDropped(DROP_HANDLER_ERROR);
                return Mono.empty();
            });
    }

    /**
     * Top-level {@code application}, falling back to {@code channel.dialplan.app_data}.
     */
    static String resolveApplicationName(JsonNode document) {
        String application = text(document.path(Exchanges.FIELD_APPLICATION));
        if (application != null) {
            return application;
        }
        JsonNode fallback = document;
        for (String field : Exchanges.APPLICATION_FALLBACK_PATH) {
            fallback = fallback.path(field);
        }
        return text(fallback);
    }

    private static String text(JsonNode node) {
        if (!node.isTextual() || node.asText().isEmpty()) {
            return null;
        }
        return node.asText();
    }
}

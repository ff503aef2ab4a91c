package com.callplane.applicationd.bus;

import com.callplane.applicationd.metrics.MetricsService;
import com.callplane.core.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the broker connection and keeps it alive.
 * <p>
 * Every successful connection starts a new <i>generation</i>: one consumer and one
 * producer pipeline bound to that connection. When the connection dies, or either
 * pipeline stops, the generation is torn down and a new connection is opened.
 * Failed connection attempts are retried forever with a fixed delay.
 * </p>
 * <p>
 * Only the supervisor disposes the pipelines, and at most one generation is alive
 * at any time.
 * </p>
 */
public class BusSupervisor {
    private static final Logger log = LoggerFactory.getLogger(BusSupervisor.class);

    private static final Duration GENERATION_PAUSE = Duration.ofMillis(100);

    private final BrokerConnector connector;
    private final BusConsumer consumer;
    private final BusProducer producer;
    private final OutboundQueue outbound;
    private final Duration reconnectionRate;
    private final MetricsService metrics;

    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger activePairs = new AtomicInteger();

    public BusSupervisor(BrokerConnector connector,
                         BusConsumer consumer,
                         BusProducer producer,
                         OutboundQueue outbound,
                         Duration reconnectionRate,
                         MetricsService metrics) {
        this.connector = connector;
        this.consumer = consumer;
        this.producer = producer;
        this.outbound = outbound;
        this.reconnectionRate = reconnectionRate;
        this.metrics = metrics;
    }

    /**
     * Runs until the subscription is disposed. Disposing closes the live connection.
     *
     * @return Mono that never completes on its own
     */
    public Mono<Void> run() {
        return Mono.defer(this::connect)
            .retryWhen(RetryPolicy.fixedDelayForever(reconnectionRate, log, "Connection to broker"))
            .flatMap(this::supervise)
            .then(Mono.delay(GENERATION_PAUSE))
            .repeat()
            .then()
            .doOnSubscribe(s -> log.info("Bus supervisor started"))
            .doFinally(signal -> log.info("Bus supervisor stopped ({})", signal));
    }

    private Mono<BrokerSession> connect() {
        log.info("Connecting to broker...");
        return handOver(connector.connect())
            .doOnNext(session -> metrics.recordConnect(true))
            .onErrorMap(BrokerFailures::wrap)
            .doOnError(err -> metrics.recordConnect(false));
    }

    /**
     * Lets a pending attempt finish when the supervisor is cancelled, so that a session
     * opened after cancellation is closed here instead of being dropped unowned.
     */
    private static Mono<BrokerSession> handOver(Mono<BrokerSession> attempt) {
        return Mono.create(sink -> {
            AtomicBoolean settled = new AtomicBoolean();
            sink.onCancel(() -> settled.set(true));
            attempt.subscribe(
                session -> {
                    if (settled.compareAndSet(false, true)) {
                        sink.success(session);
                    } else {
                        log.info("Closing broker connection opened after the supervisor stopped");
                        session.close();
                    }
                },
                err -> {
                    if (settled.compareAndSet(false, true)) {
                        sink.error(err);
                    } else {
                        log.debug("Connection attempt failed after the supervisor stopped: {}", err.getMessage());
                    }
                },
                () -> {
                    if (settled.compareAndSet(false, true)) {
                        sink.success();
                    }
                });
        });
    }

    private Mono<Void> supervise(BrokerSession session) {
        long current = generation.incrementAndGet();
        Sinks.Empty<Void> pipelineStopped = Sinks.empty();

        Disposable consuming = consumer.consume(session.inbound()).subscribe(
            null,
            err -> {
                log.error("Consumer of generation {} failed: {}", current, err.getMessage());
                pipelineStopped.tryEmitEmpty();
            },
            () -> {
                log.warn("Consumer of generation {} completed", current);
                pipelineStopped.tryEmitEmpty();
            });
        Disposable producing = producer.produce(outbound.drain(), session).subscribe(
            null,
            err -> {
                log.error("Producer of generation {} failed: {}", current, err.getMessage());
                pipelineStopped.tryEmitEmpty();
            },
            () -> pipelineStopped.tryEmitEmpty());
        Disposable pair = Disposables.composite(consuming, producing);

        int alive = activePairs.incrementAndGet();
        log.info("Successfully connected and consuming (generation {}, active pairs {})", current, alive);

        return Mono.firstWithSignal(session.closed(), pipelineStopped.asMono())
            .doOnSuccess(v -> log.warn("Broker connection of generation {} lost", current))
            .doFinally(signal -> {
                pair.dispose();
                activePairs.decrementAndGet();
                session.close();
                log.debug("Generation {} torn down ({})", current, signal);
            });
    }

    /**
     * Number of connections established so far.
     */
    public long generation() {
        return generation.get();
    }

    /**
     * Number of consumer/producer pairs currently running, 0 or 1.
     */
    public int activePairs() {
        return activePairs.get();
    }
}

package com.callplane.applicationd.bus;

import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fails a given number of times, then hands out a new {@link TestBrokerSession}
 * on every call, each attempt taking {@code connectDelay}.
 */
class TestBrokerConnector implements BrokerConnector {
    private final AtomicInteger failuresLeft;
    private final AtomicInteger attempts = new AtomicInteger();
    private final List<TestBrokerSession> sessions = new CopyOnWriteArrayList<>();

    private final Duration connectDelay;

    TestBrokerConnector(int failures) {
        this(failures, Duration.ZERO);
    }

    TestBrokerConnector(int failures, Duration connectDelay) {
        this.failuresLeft = new AtomicInteger(failures);
        this.connectDelay = connectDelay;
    }

    @Override
    public Mono<BrokerSession> connect() {
        return Mono.defer(() -> {
            attempts.incrementAndGet();
            Mono<BrokerSession> outcome = Mono.defer(() -> {
                if (failuresLeft.getAndDecrement() > 0) {
                    return Mono.error(new IOException("Connection refused"));
                }
                TestBrokerSession session = new TestBrokerSession();
                sessions.add(session);
                return Mono.just(session);
            });
            return connectDelay.isZero() ? outcome : Mono.delay(connectDelay).then(outcome);
        });
    }

    int attempts() {
        return attempts.get();
    }

    List<TestBrokerSession> sessions() {
        return sessions;
    }

    TestBrokerSession last() {
        return sessions.get(sessions.size() - 1);
    }
}

package com.callplane.applicationd.bus;

import com.callplane.core.error.FailureKind;
import com.rabbitmq.client.MalformedFrameException;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Sorts broker errors into {@link FailureKind}s.
 * <p>
 * The cause chain is walked because the AMQP client and reactor-rabbitmq both wrap
 * the interesting exception.
 * </p>
 */
public final class BrokerFailures {
    private BrokerFailures() {
    }

    public static FailureKind classify(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof BrokerException) {
                return ((BrokerException) current).getKind();
            }
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return FailureKind.CANCELLATION;
            }
            // subclasses of IOException, so they must be checked first
            if (current instanceof PossibleAuthenticationFailureException
                || current instanceof MalformedFrameException
                || current instanceof ShutdownSignalException) {
                return FailureKind.PROTOCOL;
            }
            if (current instanceof IOException || current instanceof TimeoutException) {
                return FailureKind.TRANSPORT;
            }
        }
        return FailureKind.TRANSPORT;
    }

    public static BrokerException wrap(Throwable error) {
        if (error instanceof BrokerException) {
            return (BrokerException) error;
        }
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new BrokerException(classify(error), detail, error);
    }
}

package com.callplane.core.util;

import com.callplane.core.error.ClassifiedFailure;
import org.slf4j.Logger;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Retry policies for the long-running loops.
 * <p>
 * Every loop in the dispatcher retries forever: the process must ride out
 * broker restarts and catalog outages instead of dying. The only policy is a
 * fixed delay between attempts with no attempt limit. Failures classified as
 * not retryable (see {@link com.callplane.core.error.FailureKind}) are propagated at once.
 * </p>
 */
public final class RetryPolicy {
    private RetryPolicy() {
    }

    /**
     * Fixed-delay, unbounded retry.
     *
     * @param delay pause between two attempts
     * @param log   logger receiving one error line per failed attempt
     * @param what  human readable name of the retried operation
     * @return a {@link Retry} spec usable with {@code retryWhen}
     */
    public static Retry fixedDelayForever(Duration delay, Logger log, String what) {
        return Retry.fixedDelay(Long.MAX_VALUE, delay)
            .filter(RetryPolicy::isRetryable)
            .doBeforeRetry(signal -> log.error("{} failed (attempt {}): {}. Will retry in {} seconds",
                what, signal.totalRetries() + 1, describe(signal), delay.toSeconds()));
    }

    static boolean isRetryable(Throwable failure) {
        if (failure instanceof ClassifiedFailure) {
            return ((ClassifiedFailure) failure).getKind().isRetryable();
        }
        return true;
    }

    private static String describe(Retry.RetrySignal signal) {
        Throwable failure = signal.failure();
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}

package com.callplane.core.error;

/**
 * Classification of the failures the long-running loops can meet.
 * <ul>
 *   <li>{@link #TRANSPORT}: connection refused, DNS, socket and timeout errors. Retried.</li>
 *   <li>{@link #PROTOCOL}: the peer rejected credentials or the handshake. Retried like transport.</li>
 *   <li>{@link #VALIDATION}: an inbound message is malformed. Dropped, never retried.</li>
 *   <li>{@link #CATALOG}: the catalog answered with an error or refused a write.</li>
 *   <li>{@link #CANCELLATION}: the loop is being stopped. Not an error.</li>
 * </ul>
 */
public enum FailureKind {
    TRANSPORT(true),
    PROTOCOL(true),
    VALIDATION(false),
    CATALOG(true),
    CANCELLATION(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

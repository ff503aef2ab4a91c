package com.callplane.applicationd.bus;

import com.callplane.core.error.ClassifiedFailure;
import com.callplane.core.error.FailureKind;
import lombok.Getter;

/**
 * Broker failure tagged with its {@link FailureKind}.
 */
@Getter
public class BrokerException extends RuntimeException implements ClassifiedFailure {

    private final FailureKind kind;

    public BrokerException(FailureKind kind, String message, Throwable cause) {
        super(kind + ": " + message, cause);
        this.kind = kind;
    }
}

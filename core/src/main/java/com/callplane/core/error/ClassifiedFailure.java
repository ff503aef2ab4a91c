package com.callplane.core.error;

/**
 * An exception that knows its {@link FailureKind}.
 */
public interface ClassifiedFailure {

    FailureKind getKind();
}

package com.callplane.applicationd.discovery.catalog;

import com.callplane.core.error.ClassifiedFailure;
import com.callplane.core.error.FailureKind;

/**
 * The catalog could not be reached or refused a request.
 */
public class CatalogException extends RuntimeException implements ClassifiedFailure {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.CATALOG;
    }
}

package com.catalog.reconciliation.core.error;

/**
 * Base class of every exception raised by the reconciliation engine.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}

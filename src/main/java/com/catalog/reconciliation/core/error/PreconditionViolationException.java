package com.catalog.reconciliation.core.error;

/**
 * A record or batch lacks configuration it requires, such as vendor info for a
 * cataloging record or matchpoints for an order-level batch. Aborts the record.
 */
public class PreconditionViolationException extends ReconciliationException {

    public PreconditionViolationException(String message) {
        super(message);
    }
}

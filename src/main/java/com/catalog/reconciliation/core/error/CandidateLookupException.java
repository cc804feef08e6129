package com.catalog.reconciliation.core.error;

/**
 * The catalog search service could not be queried. A failed lookup is never
 * treated as "no candidates"; retries belong to the caller.
 */
public class CandidateLookupException extends ReconciliationException {

    public CandidateLookupException(String message) {
        super(message);
    }

    public CandidateLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}

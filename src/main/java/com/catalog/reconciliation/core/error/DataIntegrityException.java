package com.catalog.reconciliation.core.error;

/**
 * Processing would corrupt data: a rebuilt call number differs from its source,
 * or incoming records repeat a barcode. Aborts the batch.
 */
public class DataIntegrityException extends ReconciliationException {

    public DataIntegrityException(String message) {
        super(message);
    }
}

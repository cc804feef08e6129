package com.catalog.reconciliation.core.model;

/**
 * Outcome of the decision engine for a single record.
 */
public enum CatalogAction {
    /** New catalog entry. */
    INSERT,

    /** Link item or order data to an existing entry, leaving it unchanged. */
    ATTACH,

    /** Replace an existing entry's descriptive data. */
    OVERLAY
}

package com.catalog.reconciliation.core.model;

/**
 * Who created a catalog record. In-house records are authoritative;
 * vendor records may be overlaid when the incoming record is newer.
 */
public enum CatalogSource {
    IN_HOUSE,
    VENDOR
}

package com.catalog.reconciliation.core.model;

import java.util.Objects;

/**
 * A single-subfield MARC field a vendor requires on every record it supplies.
 * Blank indicators are normalized to a space.
 */
public record VendorField(String tag, String ind1, String ind2, String subfieldCode, String value) {

    public VendorField {
        Objects.requireNonNull(tag, "tag is required");
        Objects.requireNonNull(subfieldCode, "subfieldCode is required");
        Objects.requireNonNull(value, "value is required");
        ind1 = ind1 == null || ind1.isEmpty() ? " " : ind1;
        ind2 = ind2 == null || ind2.isEmpty() ? " " : ind2;
    }
}

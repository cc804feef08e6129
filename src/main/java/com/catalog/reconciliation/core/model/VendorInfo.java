package com.catalog.reconciliation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Identifies the vendor that produced an incoming record.
 *
 * @param name        vendor name, e.g. {@code BT SERIES}
 * @param fields      vendor-specific fields injected verbatim into cataloging records
 * @param matchpoints matchpoints used for cataloging workflow records
 */
public record VendorInfo(String name, List<VendorField> fields, Matchpoints matchpoints) {

    public VendorInfo {
        Objects.requireNonNull(name, "name is required");
        fields = fields != null ? List.copyOf(fields) : List.of();
        matchpoints = matchpoints != null ? matchpoints : Matchpoints.none();
    }
}

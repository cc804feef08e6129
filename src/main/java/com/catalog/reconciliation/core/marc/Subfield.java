package com.catalog.reconciliation.core.marc;

import java.util.Objects;

/**
 * A coded subfield of a MARC data field.
 */
public record Subfield(String code, String value) {

    public Subfield {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(value, "value is required");
    }
}

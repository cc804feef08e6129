package com.catalog.reconciliation.core.marc;

import java.util.Objects;

/**
 * MARC control field (tags 001 through 009).
 */
public record ControlField(String tag, String data) {

    public ControlField {
        Objects.requireNonNull(tag, "tag is required");
        Objects.requireNonNull(data, "data is required");
    }
}

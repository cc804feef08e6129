package com.catalog.reconciliation.core.model;

import java.util.Locale;

/**
 * Catalog partition a record or candidate belongs to.
 * The code is the value carried by collection-code fields and search backends.
 */
public enum Collection {
    BRANCH("BL"),
    RESEARCH("RL"),
    MIXED("MIXED"),
    NONE("NONE");

    private final String code;

    Collection(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses a collection code ({@code BL}, {@code RL}, {@code MIXED}, {@code NONE}).
     * A null or blank code maps to {@link #NONE}.
     *
     * @throws IllegalArgumentException if the code is not recognized
     */
    public static Collection fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NONE;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (Collection collection : values()) {
            if (collection.code.equals(normalized) || collection.name().equals(normalized)) {
                return collection;
            }
        }
        throw new IllegalArgumentException("Unknown collection code: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}

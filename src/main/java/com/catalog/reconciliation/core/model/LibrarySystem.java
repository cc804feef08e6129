package com.catalog.reconciliation.core.model;

import java.util.Locale;

/**
 * Library systems whose catalogs can be reconciled.
 */
public enum LibrarySystem {
    /** Uses collection codes (910) and splits Branch and Research call numbers. */
    NYPL("nypl"),
    BPL("bpl");

    private final String code;

    LibrarySystem(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static LibrarySystem fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Library system code is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (LibrarySystem library : values()) {
            if (library.code.equals(normalized)) {
                return library;
            }
        }
        throw new IllegalArgumentException("Unknown library system: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}

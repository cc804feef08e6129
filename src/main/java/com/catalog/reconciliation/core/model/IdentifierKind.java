package com.catalog.reconciliation.core.model;

import java.util.Locale;

/**
 * Identifier kinds usable as matchpoints against the catalog search service.
 */
public enum IdentifierKind {
    BIB_ID("bib_id"),
    ISBN("isbn"),
    OCLC_NUMBER("oclc_number"),
    UPC("upc");

    private final String key;

    IdentifierKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolves a matchpoint key such as {@code isbn} or {@code oclc_number}.
     *
     * @throws IllegalArgumentException for unsupported keys
     */
    public static IdentifierKind fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (IdentifierKind kind : values()) {
                if (kind.key.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Invalid matchpoint: '" + key
                + "'. Available matchpoints are: [bib_id, isbn, oclc_number, upc]");
    }

    @Override
    public String toString() {
        return key;
    }
}

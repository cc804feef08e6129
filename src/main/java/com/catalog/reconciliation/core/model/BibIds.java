package com.catalog.reconciliation.core.model;

/**
 * Helpers for catalog bib ids, which carry a fixed {@code .b} prefix and
 * may end in a check digit or {@code x}.
 */
public final class BibIds {

    public static final String PREFIX = ".b";

    private BibIds() {
    }

    /**
     * Returns the digits of a bib id with the prefix and any trailing check character removed.
     * {@code .b12345678x} and {@code 12345678} both yield {@code 12345678}.
     */
    public static String digits(String bibId) {
        String stripped = withoutPrefix(bibId);
        int end = 0;
        while (end < stripped.length() && Character.isDigit(stripped.charAt(end))) {
            end++;
        }
        if (end == 0) {
            throw new IllegalArgumentException("Bib id has no numeric part: " + bibId);
        }
        return stripped.substring(0, end);
    }

    public static long numericPart(String bibId) {
        return Long.parseLong(digits(bibId));
    }

    /**
     * Formats a bib id the way the catalog loader expects it: {@code .b} followed by
     * the id without any existing prefix. A trailing check character is kept.
     */
    public static String normalize(String bibId) {
        return PREFIX + withoutPrefix(bibId);
    }

    private static String withoutPrefix(String bibId) {
        if (bibId == null || bibId.isBlank()) {
            throw new IllegalArgumentException("bibId is required");
        }
        String stripped = bibId.trim();
        if (stripped.startsWith(PREFIX)) {
            return stripped.substring(PREFIX.length());
        }
        if (stripped.startsWith("b")) {
            return stripped.substring(1);
        }
        return stripped;
    }
}

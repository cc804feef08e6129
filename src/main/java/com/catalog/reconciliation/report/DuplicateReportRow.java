package com.catalog.reconciliation.report;

import java.util.List;

/**
 * A record whose lookup turned up more than one catalog copy or copies in other collections.
 */
public record DuplicateReportRow(String vendor, String resourceId, String targetId,
                                 List<String> duplicates, List<String> mixed, List<String> other) {
    public DuplicateReportRow {
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
        mixed = mixed != null ? List.copyOf(mixed) : List.of();
        other = other != null ? List.copyOf(other) : List.of();
    }
}

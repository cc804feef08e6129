package com.catalog.reconciliation.report;

import com.catalog.reconciliation.core.model.CatalogAction;

import java.util.List;

/**
 * One row per processed record.
 */
public record DetailReportRow(String vendor, String resourceId, CatalogAction action, String targetId,
                              boolean updatedByVendor, boolean callNumberMatch, String callNumber,
                              String targetCallNumber, List<String> duplicates, List<String> mixed,
                              List<String> other) {
    public DetailReportRow {
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
        mixed = mixed != null ? List.copyOf(mixed) : List.of();
        other = other != null ? List.copyOf(other) : List.of();
    }
}

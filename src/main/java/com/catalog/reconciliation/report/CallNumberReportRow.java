package com.catalog.reconciliation.report;

import java.util.List;

/**
 * A record whose call number disagrees with its target, or is missing on both sides.
 */
public record CallNumberReportRow(String vendor, String resourceId, String targetId,
                                  List<String> duplicates, boolean callNumberMatch,
                                  String callNumber, String targetCallNumber) {
    public CallNumberReportRow {
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
    }
}

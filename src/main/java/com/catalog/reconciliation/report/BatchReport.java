package com.catalog.reconciliation.report;

import com.catalog.reconciliation.core.model.MatchAnalysis;
import com.catalog.reconciliation.core.model.Workflow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports derived from the analyses of one batch.
 */
public record BatchReport(
        String batchId,
        Instant generatedAt,
        List<DetailReportRow> details,
        List<DuplicateReportRow> duplicates,
        List<CallNumberReportRow> callNumberIssues,
        List<VendorTally> vendorTallies
) {
    private static final String UNKNOWN_VENDOR = "UNKNOWN";

    public BatchReport {
        details = details != null ? List.copyOf(details) : List.of();
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
        callNumberIssues = callNumberIssues != null ? List.copyOf(callNumberIssues) : List.of();
        vendorTallies = vendorTallies != null ? List.copyOf(vendorTallies) : List.of();
    }

    public static BatchReport from(String batchId, List<MatchAnalysis> analyses, Instant generatedAt) {
        List<DetailReportRow> details = new ArrayList<>();
        List<DuplicateReportRow> duplicates = new ArrayList<>();
        List<CallNumberReportRow> callNumberIssues = new ArrayList<>();
        Map<String, int[]> counts = new LinkedHashMap<>();

        for (MatchAnalysis analysis : analyses) {
            String vendor = analysis.vendor() != null ? analysis.vendor() : UNKNOWN_VENDOR;
            details.add(new DetailReportRow(vendor, analysis.resourceId(), analysis.action(), analysis.targetId(),
                    analysis.updatedByVendor(), analysis.callNumberMatch(), analysis.callNumber(),
                    analysis.targetCallNumber(), analysis.duplicateRecords(), analysis.mixed(), analysis.other()));

            if (!analysis.duplicateRecords().isEmpty() || !analysis.mixed().isEmpty() || !analysis.other().isEmpty()) {
                duplicates.add(new DuplicateReportRow(vendor, analysis.resourceId(), analysis.targetId(),
                        analysis.duplicateRecords(), analysis.mixed(), analysis.other()));
            }

            boolean missingBoth = analysis.workflow() == Workflow.CATALOGING
                    && analysis.callNumber() == null && analysis.targetCallNumber() == null;
            if (!analysis.callNumberMatch() || missingBoth) {
                callNumberIssues.add(new CallNumberReportRow(vendor, analysis.resourceId(), analysis.targetId(),
                        analysis.duplicateRecords(), analysis.callNumberMatch(), analysis.callNumber(),
                        analysis.targetCallNumber()));
            }

            int[] tally = counts.computeIfAbsent(vendor, k -> new int[3]);
            switch (analysis.action()) {
                case ATTACH -> tally[0]++;
                case INSERT -> tally[1]++;
                case OVERLAY -> tally[2]++;
            }
        }

        List<VendorTally> tallies = new ArrayList<>();
        counts.forEach((vendor, c) -> tallies.add(new VendorTally(vendor, c[0], c[1], c[2])));
        return new BatchReport(batchId, generatedAt, details, duplicates, callNumberIssues, tallies);
    }

    public int totalRecords() {
        return details.size();
    }
}

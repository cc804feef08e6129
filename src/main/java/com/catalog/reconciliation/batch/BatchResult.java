package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.model.MatchAnalysis;
import com.catalog.reconciliation.report.BatchReport;

import java.util.List;

/**
 * Result of a batch run.
 *
 * @param analyses one analysis per successfully processed record, in input order
 * @param errors   messages of records that could not be processed
 */
public record BatchResult(
        String batchId,
        List<MatchAnalysis> analyses,
        DedupeResult dedupe,
        IntegrityReport integrity,
        BatchReport report,
        List<String> errors
) {
    public BatchResult {
        analyses = analyses != null ? List.copyOf(analyses) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean isSuccess() {
        return errors.isEmpty() && integrity.valid();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "batchId=" + batchId +
                ", processed=" + analyses.size() +
                ", attach=" + dedupe.attach().size() +
                ", deduped=" + dedupe.deduped().size() +
                ", valid=" + integrity.valid() +
                ", errors=" + errors.size() +
                '}';
    }
}

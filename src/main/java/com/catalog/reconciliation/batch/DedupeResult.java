package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.model.BibRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Records split for output.
 *
 * @param attach  records attaching to an existing catalog record
 * @param newRecords records to insert or overlay, before merging
 * @param deduped {@code newRecords} with in-batch duplicates folded together
 */
public record DedupeResult(List<BibRecord> attach, List<BibRecord> newRecords, List<BibRecord> deduped) {

    public DedupeResult {
        attach = attach != null ? List.copyOf(attach) : List.of();
        newRecords = newRecords != null ? List.copyOf(newRecords) : List.of();
        deduped = deduped != null ? List.copyOf(deduped) : List.of();
    }

    /**
     * Records that are written out: attachments plus deduplicated new records.
     */
    public List<BibRecord> output() {
        List<BibRecord> output = new ArrayList<>(attach);
        output.addAll(deduped);
        return output;
    }

    public int mergedCount() {
        return newRecords.size() - deduped.size();
    }
}

package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.marc.DataField;
import com.catalog.reconciliation.core.marc.MarcRecord;
import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.CatalogAction;
import com.catalog.reconciliation.core.model.MatchAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds new records that share a control number into one record carrying all
 * of their items. Attachments are never merged.
 */
public class BatchDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(BatchDeduplicator.class);

    /**
     * @param records  processed records
     * @param analyses analyses in the same order as {@code records}
     */
    public DedupeResult dedupe(List<BibRecord> records, List<MatchAnalysis> analyses) {
        if (records.size() != analyses.size()) {
            throw new IllegalArgumentException("records and analyses differ in size: "
                    + records.size() + " vs " + analyses.size());
        }
        List<BibRecord> attach = new ArrayList<>();
        List<BibRecord> newRecords = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            if (analyses.get(i).action() == CatalogAction.ATTACH) {
                attach.add(records.get(i));
            } else {
                newRecords.add(records.get(i));
            }
        }
        if (newRecords.isEmpty()) {
            return new DedupeResult(attach, newRecords, List.of());
        }

        // records without a control number cannot be compared and stay on their own
        Map<Object, List<BibRecord>> groups = new LinkedHashMap<>();
        for (BibRecord record : newRecords) {
            Object key = record.getControlNumber() != null ? record.getControlNumber() : new Object();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        List<BibRecord> deduped = new ArrayList<>(groups.size());
        for (List<BibRecord> group : groups.values()) {
            if (group.size() == 1) {
                deduped.add(group.get(0));
            } else {
                deduped.add(merge(group));
            }
        }
        log.debug("batch.deduped newRecords={} deduped={} groups={}",
                newRecords.size(), deduped.size(), groups.size());
        return new DedupeResult(attach, newRecords, deduped);
    }

    /**
     * Copies the item fields of every later group member into a copy of the first member.
     */
    private BibRecord merge(List<BibRecord> group) {
        BibRecord first = group.get(0);
        ItemFields.Spec spec = ItemFields.specFor(first);
        MarcRecord merged = first.getMarcRecord();
        List<String> barcodes = new ArrayList<>(first.getBarcodes());
        for (BibRecord duplicate : group.subList(1, group.size())) {
            for (DataField item : ItemFields.items(duplicate.getMarcRecord(), spec)) {
                merged.addOrderedField(item);
            }
            barcodes.addAll(duplicate.getBarcodes());
        }
        log.info("record.merged controlNumber={} members={}", first.getControlNumber(), group.size());
        return first.toBuilder().marcRecord(merged).barcodes(barcodes).build();
    }
}

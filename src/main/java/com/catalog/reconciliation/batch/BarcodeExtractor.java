package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.error.DataIntegrityException;
import com.catalog.reconciliation.core.model.BibRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the item barcodes of incoming records before any processing.
 */
public class BarcodeExtractor {

    /**
     * @throws DataIntegrityException if any barcode occurs more than once
     */
    public List<String> extract(List<BibRecord> records) {
        List<String> barcodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (BibRecord record : records) {
            for (String barcode : record.getBarcodes()) {
                if (!seen.add(barcode)) {
                    duplicates.add(barcode);
                }
                barcodes.add(barcode);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DataIntegrityException("Duplicate barcodes found in file: " + duplicates);
        }
        return barcodes;
    }
}

package com.catalog.reconciliation.batch;

import com.catalog.reconciliation.core.model.BibRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Checks that processing neither lost nor duplicated any item barcode.
 * Problems are logged and reported, never thrown.
 */
public class BarcodeIntegrityValidator {
    private static final Logger log = LoggerFactory.getLogger(BarcodeIntegrityValidator.class);

    public IntegrityReport validate(List<BibRecord> output, List<String> originalBarcodes) {
        List<String> found = new ArrayList<>();
        for (BibRecord record : output) {
            found.addAll(ItemFields.barcodes(record));
        }

        Map<String, Integer> remaining = new HashMap<>();
        for (String barcode : found) {
            remaining.merge(barcode, 1, Integer::sum);
        }
        TreeSet<String> missing = new TreeSet<>();
        for (String barcode : originalBarcodes) {
            Integer count = remaining.get(barcode);
            if (count == null || count == 0) {
                missing.add(barcode);
            } else {
                remaining.put(barcode, count - 1);
            }
        }

        List<String> sortedOriginal = new ArrayList<>(originalBarcodes);
        Collections.sort(sortedOriginal);
        Collections.sort(found);
        boolean valid = sortedOriginal.equals(found);

        log.debug("integrity.validated valid={} expected={} found={}", valid, originalBarcodes.size(), found.size());
        if (!valid) {
            log.error("integrity.failed missingBarcodes={} expected={} found={}",
                    missing, originalBarcodes.size(), found.size());
        }
        return new IntegrityReport(valid, new ArrayList<>(missing));
    }
}

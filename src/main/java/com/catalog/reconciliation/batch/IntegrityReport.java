package com.catalog.reconciliation.batch;

import java.util.List;

/**
 * Outcome of comparing output barcodes with input barcodes.
 *
 * @param missing input barcodes absent from the output
 */
public record IntegrityReport(boolean valid, List<String> missing) {

    public IntegrityReport {
        missing = missing != null ? List.copyOf(missing) : List.of();
    }

    public static IntegrityReport skipped() {
        return new IntegrityReport(true, List.of());
    }
}

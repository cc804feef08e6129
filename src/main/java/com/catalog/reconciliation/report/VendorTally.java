package com.catalog.reconciliation.report;

/**
 * Count of decisions per action for one vendor.
 */
public record VendorTally(String vendor, int attach, int insert, int overlay) {

    public int total() {
        return attach + insert + overlay;
    }
}

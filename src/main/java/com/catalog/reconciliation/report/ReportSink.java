package com.catalog.reconciliation.report;

/**
 * Receives the report of each processed batch, e.g. to publish it to a spreadsheet.
 */
public interface ReportSink {

    void accept(BatchReport report);
}

package com.catalog.reconciliation.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ReportSink} that writes a summary of each report to the log.
 */
public class LoggingReportSink implements ReportSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingReportSink.class);

    @Override
    public void accept(BatchReport report) {
        log.info("report.generated batchId={} records={} duplicates={} callNumberIssues={}",
                report.batchId(), report.totalRecords(), report.duplicates().size(),
                report.callNumberIssues().size());
        for (VendorTally tally : report.vendorTallies()) {
            log.info("report.vendor batchId={} vendor={} attach={} insert={} overlay={} total={}",
                    report.batchId(), tally.vendor(), tally.attach(), tally.insert(), tally.overlay(),
                    tally.total());
        }
        for (CallNumberReportRow row : report.callNumberIssues()) {
            log.warn("report.callNumberMismatch batchId={} resourceId={} target={} callNumber={} targetCallNumber={}",
                    report.batchId(), row.resourceId(), row.targetId(), row.callNumber(), row.targetCallNumber());
        }
    }
}

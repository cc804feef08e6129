package com.catalog.reconciliation.batch;

/**
 * Output files a processed batch is written to.
 */
public enum OutputBatch {
    /** Records attaching to existing catalog records. */
    DUP,
    /** New records before deduplication. */
    NEW,
    /** New records after deduplication. */
    DEDUPED
}

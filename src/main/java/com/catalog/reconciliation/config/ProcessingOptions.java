package com.catalog.reconciliation.config;

import java.time.Duration;

/**
 * Options for batch runs: worker pool size, per-record timeout, maximum batch size
 * and whether output barcodes are checked against the input.
 */
public class ProcessingOptions {

    private static final int DEFAULT_WORKER_COUNT = 4;
    private static final Duration DEFAULT_RECORD_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_BATCH_SIZE = 10_000;

    private final int workerCount;
    private final Duration recordTimeout;
    private final int maxBatchSize;
    private final boolean validateIntegrity;

    private ProcessingOptions(Builder builder) {
        this.workerCount = builder.workerCount;
        this.recordTimeout = builder.recordTimeout;
        this.maxBatchSize = builder.maxBatchSize;
        this.validateIntegrity = builder.validateIntegrity;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public Duration getRecordTimeout() {
        return recordTimeout;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public boolean isValidateIntegrity() {
        return validateIntegrity;
    }

    public static ProcessingOptions defaults() {
        return builder().build();
    }

    /**
     * Single worker, used when lookups must be strictly sequential.
     */
    public static ProcessingOptions sequential() {
        return builder().workerCount(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int workerCount = DEFAULT_WORKER_COUNT;
        private Duration recordTimeout = DEFAULT_RECORD_TIMEOUT;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private boolean validateIntegrity = true;

        public Builder workerCount(int workerCount) {
            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount must be >= 1");
            }
            this.workerCount = workerCount;
            return this;
        }

        public Builder recordTimeout(Duration recordTimeout) {
            if (recordTimeout == null || recordTimeout.isNegative() || recordTimeout.isZero()) {
                throw new IllegalArgumentException("recordTimeout must be positive");
            }
            this.recordTimeout = recordTimeout;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize < 1) {
                throw new IllegalArgumentException("maxBatchSize must be >= 1");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder validateIntegrity(boolean validateIntegrity) {
            this.validateIntegrity = validateIntegrity;
            return this;
        }

        public ProcessingOptions build() {
            return new ProcessingOptions(this);
        }
    }
}

package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CatalogAction;
import com.catalog.reconciliation.core.model.IdentifierKind;

import java.time.Duration;

/**
 * {@link MetricsService} that discards everything.
 */
public final class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    private NoOpMetricsService() {
    }

    @Override
    public void incrementAction(String vendor, CatalogAction action) {
    }

    @Override
    public void recordLookupDuration(IdentifierKind kind, Duration duration) {
    }

    @Override
    public void incrementLookupFailure(IdentifierKind kind) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementDuplicatesMerged(int count) {
    }

    @Override
    public void incrementIntegrityFailure() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

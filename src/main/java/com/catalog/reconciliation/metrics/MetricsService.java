package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CatalogAction;
import com.catalog.reconciliation.core.model.IdentifierKind;

import java.time.Duration;

/**
 * Records reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a metrics backend.
 */
public interface MetricsService {

    void incrementAction(String vendor, CatalogAction action);

    void recordLookupDuration(IdentifierKind kind, Duration duration);

    void incrementLookupFailure(IdentifierKind kind);

    void recordBatchSize(int size);

    void incrementDuplicatesMerged(int count);

    void incrementIntegrityFailure();

    void recordCacheHit();

    void recordCacheMiss();
}

package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CatalogAction;
import com.catalog.reconciliation.core.model.IdentifierKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.action} (Counter, tags: vendor, action)</li>
 *   <li>{@code reconciliation.lookup.duration} (Timer, tag: kind)</li>
 *   <li>{@code reconciliation.lookup.failure} (Counter, tag: kind)</li>
 *   <li>{@code reconciliation.batch.size} (DistributionSummary)</li>
 *   <li>{@code reconciliation.duplicates.merged} (Counter)</li>
 *   <li>{@code reconciliation.integrity.failure} (Counter)</li>
 *   <li>{@code reconciliation.cache.hit} / {@code reconciliation.cache.miss} (Counters)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final Counter duplicatesMergedCounter;
    private final Counter integrityFailureCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("reconciliation.batch.size")
                .description("Number of records per processed batch")
                .register(registry);
        this.duplicatesMergedCounter = Counter.builder("reconciliation.duplicates.merged")
                .description("Records folded into another record by deduplication")
                .register(registry);
        this.integrityFailureCounter = Counter.builder("reconciliation.integrity.failure")
                .description("Batches whose output lost item barcodes")
                .register(registry);
        this.cacheHitCounter = Counter.builder("reconciliation.cache.hit")
                .description("Candidate lookup cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("reconciliation.cache.miss")
                .description("Candidate lookup cache misses")
                .register(registry);
    }

    @Override
    public void incrementAction(String vendor, CatalogAction action) {
        String vendorTag = vendor != null ? vendor : "UNKNOWN";
        String key = "action:" + vendorTag + ":" + action.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconciliation.action")
                        .description("Decisions taken per vendor and action")
                        .tag("vendor", vendorTag)
                        .tag("action", action.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordLookupDuration(IdentifierKind kind, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(kind.getKey(), k ->
                Timer.builder("reconciliation.lookup.duration")
                        .description("Duration of candidate lookups")
                        .tag("kind", kind.getKey())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementLookupFailure(IdentifierKind kind) {
        String key = "lookupFailure:" + kind.getKey();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconciliation.lookup.failure")
                        .description("Failed candidate lookups")
                        .tag("kind", kind.getKey())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementDuplicatesMerged(int count) {
        duplicatesMergedCounter.increment(count);
    }

    @Override
    public void incrementIntegrityFailure() {
        integrityFailureCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}

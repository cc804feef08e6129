package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CatalogAction;
import com.catalog.reconciliation.core.model.IdentifierKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = NoOpMetricsService.INSTANCE;

            assertDoesNotThrow(() -> {
                noOp.incrementAction("BT SERIES", CatalogAction.ATTACH);
                noOp.recordLookupDuration(IdentifierKind.ISBN, Duration.ofMillis(10));
                noOp.incrementLookupFailure(IdentifierKind.ISBN);
                noOp.recordBatchSize(10);
                noOp.incrementDuplicatesMerged(2);
                noOp.incrementIntegrityFailure();
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count actions per vendor")
        void countsActions() {
            metrics.incrementAction("BT SERIES", CatalogAction.OVERLAY);
            metrics.incrementAction("BT SERIES", CatalogAction.OVERLAY);
            metrics.incrementAction(null, CatalogAction.INSERT);

            Counter overlay = registry.find("reconciliation.action")
                    .tag("vendor", "BT SERIES").tag("action", "OVERLAY").counter();
            Counter unknown = registry.find("reconciliation.action")
                    .tag("vendor", "UNKNOWN").tag("action", "INSERT").counter();

            assertNotNull(overlay);
            assertEquals(2.0, overlay.count());
            assertNotNull(unknown);
            assertEquals(1.0, unknown.count());
        }

        @Test
        @DisplayName("Should time lookups per identifier kind")
        void timesLookups() {
            metrics.recordLookupDuration(IdentifierKind.OCLC_NUMBER, Duration.ofMillis(40));

            Timer timer = registry.find("reconciliation.lookup.duration").tag("kind", "oclc_number").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Should record batch sizes and merges")
        void batchMetrics() {
            metrics.recordBatchSize(25);
            metrics.incrementDuplicatesMerged(3);
            metrics.incrementIntegrityFailure();

            DistributionSummary sizes = registry.find("reconciliation.batch.size").summary();
            assertNotNull(sizes);
            assertEquals(25.0, sizes.totalAmount());
            assertEquals(3.0, registry.find("reconciliation.duplicates.merged").counter().count());
            assertEquals(1.0, registry.find("reconciliation.integrity.failure").counter().count());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("reconciliation.cache.hit").counter().count());
            assertEquals(2.0, registry.find("reconciliation.cache.miss").counter().count());
        }
    }
}

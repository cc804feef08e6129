package com.catalog.reconciliation.cache;

import com.catalog.reconciliation.core.error.CandidateLookupException;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.IdentifierKind;
import com.catalog.reconciliation.match.CandidateSource;
import com.catalog.reconciliation.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CachingCandidateSource Tests")
class CachingCandidateSourceTest {

    @Mock
    private CandidateSource delegate;

    @Mock
    private MetricsService metrics;

    private final Candidate hit = Candidate.builder(".b11111111x").build();

    @Nested
    @DisplayName("Enabled cache")
    class EnabledTests {

        @Test
        @DisplayName("Repeated lookups should hit the cache")
        void repeatedLookupsHitCache() {
            CachingCandidateSource source = new CachingCandidateSource(delegate, CacheConfig.defaults(), metrics);
            when(delegate.getCandidates(IdentifierKind.ISBN, "978")).thenReturn(List.of(hit));

            assertEquals(List.of(hit), source.getCandidates(IdentifierKind.ISBN, "978"));
            assertEquals(List.of(hit), source.getCandidates(IdentifierKind.ISBN, "978"));

            verify(delegate, times(1)).getCandidates(IdentifierKind.ISBN, "978");
            verify(metrics).recordCacheMiss();
            verify(metrics).recordCacheHit();
            assertEquals(1, source.estimatedSize());
        }

        @Test
        @DisplayName("Same value under a different kind should be a separate entry")
        void keyIncludesKind() {
            CachingCandidateSource source = new CachingCandidateSource(delegate, CacheConfig.defaults(), metrics);
            when(delegate.getCandidates(IdentifierKind.ISBN, "123")).thenReturn(List.of());
            when(delegate.getCandidates(IdentifierKind.UPC, "123")).thenReturn(List.of(hit));

            assertTrue(source.getCandidates(IdentifierKind.ISBN, "123").isEmpty());
            assertEquals(List.of(hit), source.getCandidates(IdentifierKind.UPC, "123"));
        }

        @Test
        @DisplayName("Failures should propagate and not be cached")
        void failuresNotCached() {
            CachingCandidateSource source = new CachingCandidateSource(delegate, CacheConfig.defaults(), metrics);
            when(delegate.getCandidates(IdentifierKind.ISBN, "978"))
                    .thenThrow(new CandidateLookupException("timeout"))
                    .thenReturn(List.of(hit));

            assertThrows(CandidateLookupException.class, () -> source.getCandidates(IdentifierKind.ISBN, "978"));
            assertEquals(List.of(hit), source.getCandidates(IdentifierKind.ISBN, "978"));
        }

        @Test
        @DisplayName("Concurrent lookups of one key should call the backend once")
        void concurrentLookupsShareOneCall() throws Exception {
            CachingCandidateSource source = new CachingCandidateSource(delegate, CacheConfig.defaults(), metrics);
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(delegate.getCandidates(IdentifierKind.ISBN, "978")).thenAnswer(invocation -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return List.of(hit);
            });

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<List<Candidate>> first = pool.submit(() -> source.getCandidates(IdentifierKind.ISBN, "978"));
                assertTrue(started.await(5, TimeUnit.SECONDS));
                Future<List<Candidate>> second = pool.submit(() -> source.getCandidates(IdentifierKind.ISBN, "978"));
                release.countDown();

                assertEquals(List.of(hit), first.get(5, TimeUnit.SECONDS));
                assertEquals(List.of(hit), second.get(5, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }
            verify(delegate, times(1)).getCandidates(IdentifierKind.ISBN, "978");
        }

        @Test
        @DisplayName("invalidateAll should force fresh lookups")
        void invalidateAll() {
            CachingCandidateSource source = new CachingCandidateSource(delegate, CacheConfig.defaults(), metrics);
            when(delegate.getCandidates(IdentifierKind.ISBN, "978")).thenReturn(List.of(hit));

            source.getCandidates(IdentifierKind.ISBN, "978");
            source.invalidateAll();
            source.getCandidates(IdentifierKind.ISBN, "978");

            verify(delegate, times(2)).getCandidates(IdentifierKind.ISBN, "978");
        }
    }

    @Test
    @DisplayName("Disabled cache should always delegate")
    void disabledCacheDelegates() {
        CachingCandidateSource source = new CachingCandidateSource(delegate, CacheConfig.disabled());
        when(delegate.getCandidates(IdentifierKind.ISBN, "978")).thenReturn(List.of(hit));

        source.getCandidates(IdentifierKind.ISBN, "978");
        source.getCandidates(IdentifierKind.ISBN, "978");

        verify(delegate, times(2)).getCandidates(IdentifierKind.ISBN, "978");
        assertEquals(0, source.estimatedSize());
    }

    @Test
    @DisplayName("CacheConfig should reject non-positive limits")
    void cacheConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, Duration.ofMinutes(1), true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ZERO, true));
    }
}

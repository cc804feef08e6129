package com.catalog.reconciliation.cache;

import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.IdentifierKind;
import com.catalog.reconciliation.match.CandidateSource;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Caffeine-backed decorator that remembers lookups by {@code (kind, value)}.
 * Failed lookups are not cached.
 */
public class CachingCandidateSource implements CandidateSource {
    private static final Logger log = LoggerFactory.getLogger(CachingCandidateSource.class);

    private final CandidateSource delegate;
    private final Cache<CacheKey, List<Candidate>> cache;
    private final boolean enabled;
    private final MetricsService metrics;

    public CachingCandidateSource(CandidateSource delegate, CacheConfig config) {
        this(delegate, config, NoOpMetricsService.INSTANCE);
    }

    public CachingCandidateSource(CandidateSource delegate, CacheConfig config, MetricsService metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttl={} enabled={}",
                config.maxSize(), config.ttl(), config.enabled());
    }

    @Override
    public List<Candidate> getCandidates(IdentifierKind kind, String value) {
        if (!enabled) {
            return delegate.getCandidates(kind, value);
        }
        CacheKey key = new CacheKey(kind, value);
        // concurrent lookups of one key share a single backend call; failures are not cached
        boolean[] loaded = {false};
        List<Candidate> candidates = cache.get(key, k -> {
            loaded[0] = true;
            metrics.recordCacheMiss();
            return List.copyOf(delegate.getCandidates(k.kind(), k.value()));
        });
        if (!loaded[0]) {
            metrics.recordCacheHit();
        }
        return candidates;
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached lookups");
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    record CacheKey(IdentifierKind kind, String value) {}
}

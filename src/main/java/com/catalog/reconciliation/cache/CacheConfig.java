package com.catalog.reconciliation.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the candidate lookup cache.
 *
 * @param maxSize maximum number of cached {@code (kind, value)} lookups
 * @param ttl     how long a lookup result is reused
 * @param enabled false to pass every lookup straight through
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * 10,000 lookups, kept for the length of a typical batch run.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofMinutes(10), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}

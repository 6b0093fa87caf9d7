package com.stockinsight.marketdata.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry. Valid while {@code now - fetchedAt < ttl}; a refresh replaces
 * the entry rather than mutating it.
 */
public record CacheEntry<T>(T payload, Instant fetchedAt, Duration ttl) {

    public boolean isValidAt(Instant now) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }
}

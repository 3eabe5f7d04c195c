package io.marketlens.service.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry. Expired entries are treated as absent.
 */
public record CacheEntry<V>(String key, V value, Instant insertedAt, Duration ttl) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(insertedAt.plus(ttl));
    }
}

package io.marketlens.service.cache;

import io.marketlens.infrastructure.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory key-value cache with per-entry TTL.
 *
 * Reads past expiry return empty and leave the entry in place; expired
 * entries are removed only by {@link #purgeExpired()}, which the bootstrap
 * schedules off the read path. Writes overwrite unconditionally.
 */
public final class TtlCache<V> {
    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final String namespace;
    private final Clock clock;
    private final GatewayMetrics metrics;
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    public TtlCache(String namespace, Clock clock, GatewayMetrics metrics) {
        this.namespace = namespace;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Optional<V> get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            metrics.recordCacheLookup(namespace, false);
            return Optional.empty();
        }
        metrics.recordCacheLookup(namespace, true);
        return Optional.of(entry.value());
    }

    public void put(String key, V value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("Cache value cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        entries.put(key, new CacheEntry<>(key, value, clock.instant(), ttl));
        log.debug("[CACHE:{}] put {} ttl={}ms", namespace, key, ttl.toMillis());
    }

    /**
     * Remove expired entries. Only removes an entry if it is still the expired one,
     * so a concurrent overwrite is never lost.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (CacheEntry<V> entry : entries.values()) {
            if (entry.isExpired(now) && entries.remove(entry.key(), entry)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[CACHE:{}] purged {} expired entries", namespace, removed);
        }
        return removed;
    }

    /**
     * Raw entry count, including expired entries not yet purged.
     */
    public int size() {
        return entries.size();
    }

    public String namespace() {
        return namespace;
    }
}

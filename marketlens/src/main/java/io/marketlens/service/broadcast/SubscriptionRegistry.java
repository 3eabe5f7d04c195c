package io.marketlens.service.broadcast;

import io.marketlens.domain.data.SubscriptionKey;
import io.marketlens.domain.session.SubscriberHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Which connections want which keys.
 *
 * Two indexes kept in step: key -> (connectionId -> handle) for delivery and
 * connectionId -> keys for cleanup. Both are updated inside {@code compute}
 * so a concurrent subscribe and unsubscribe on the same key never lose an entry.
 */
public final class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    // Key -> (connectionId -> handle)
    private final ConcurrentMap<SubscriptionKey, Map<String, SubscriberHandle>> byKey = new ConcurrentHashMap<>();

    // ConnectionId -> keys
    private final ConcurrentMap<String, Set<SubscriptionKey>> byConnection = new ConcurrentHashMap<>();

    /**
     * @return true if the subscription is new, false if it already existed
     */
    public boolean subscribe(SubscriberHandle handle, SubscriptionKey key) {
        String id = handle.connectionId();
        boolean[] added = new boolean[1];
        byKey.compute(key, (k, handles) -> {
            Map<String, SubscriberHandle> m = handles == null ? new ConcurrentHashMap<>() : handles;
            added[0] = m.putIfAbsent(id, handle) == null;
            return m;
        });
        byConnection.compute(id, (c, keys) -> {
            Set<SubscriptionKey> s = keys == null ? ConcurrentHashMap.newKeySet() : keys;
            s.add(key);
            return s;
        });
        if (added[0]) {
            log.debug("[REGISTRY] {} subscribed to {}", id, key);
        }
        return added[0];
    }

    /**
     * No-op if the connection was not subscribed.
     *
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(SubscriberHandle handle, SubscriptionKey key) {
        return unsubscribe(handle.connectionId(), key);
    }

    public boolean unsubscribe(String connectionId, SubscriptionKey key) {
        boolean[] removed = new boolean[1];
        byKey.computeIfPresent(key, (k, handles) -> {
            removed[0] = handles.remove(connectionId) != null;
            return handles.isEmpty() ? null : handles;
        });
        byConnection.computeIfPresent(connectionId, (c, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
        if (removed[0]) {
            log.debug("[REGISTRY] {} unsubscribed from {}", connectionId, key);
        }
        return removed[0];
    }

    /**
     * Snapshot of the current subscribers of {@code key}; empty if none.
     */
    public Set<SubscriberHandle> subscribersOf(SubscriptionKey key) {
        Map<String, SubscriberHandle> handles = byKey.get(key);
        if (handles == null) {
            return Set.of();
        }
        return Set.copyOf(handles.values());
    }

    public Set<SubscriptionKey> subscriptionsOf(String connectionId) {
        Set<SubscriptionKey> keys = byConnection.get(connectionId);
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    /**
     * Remove every subscription held by a connection.
     *
     * @return number of subscriptions removed
     */
    public int dropConnection(String connectionId) {
        Set<SubscriptionKey> keys = byConnection.remove(connectionId);
        if (keys == null) {
            return 0;
        }
        int removed = 0;
        for (SubscriptionKey key : new HashSet<>(keys)) {
            boolean[] hit = new boolean[1];
            byKey.computeIfPresent(key, (k, handles) -> {
                hit[0] = handles.remove(connectionId) != null;
                return handles.isEmpty() ? null : handles;
            });
            if (hit[0]) removed++;
        }
        log.debug("[REGISTRY] dropped {} subscriptions of {}", removed, connectionId);
        return removed;
    }

    public int keyCount() {
        return byKey.size();
    }

    public int subscriptionCount() {
        int total = 0;
        for (Map<String, SubscriberHandle> handles : byKey.values()) {
            total += handles.size();
        }
        return total;
    }
}

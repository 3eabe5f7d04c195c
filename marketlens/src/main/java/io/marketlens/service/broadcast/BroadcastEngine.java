package io.marketlens.service.broadcast;

import io.marketlens.domain.data.MarketUpdate;
import io.marketlens.domain.data.SubscriptionKey;
import io.marketlens.domain.session.OfferResult;
import io.marketlens.domain.session.SubscriberHandle;
import io.marketlens.infrastructure.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fans market updates out to subscribers.
 *
 * Publishing is serialized per key so every subscriber sees a key's updates in
 * publish order, and updates older than the key's last published timestamp
 * are rejected. Delivery only enqueues on each subscriber's bounded buffer;
 * a slow subscriber loses its own oldest updates and never blocks publishing.
 */
public final class BroadcastEngine {
    private static final Logger log = LoggerFactory.getLogger(BroadcastEngine.class);

    private final SubscriptionRegistry registry;
    private final GatewayMetrics metrics;
    private final ConcurrentMap<SubscriptionKey, KeyState> keys = new ConcurrentHashMap<>();

    public BroadcastEngine(SubscriptionRegistry registry, GatewayMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    /**
     * @return false if the update was stale and dropped
     */
    public boolean publish(MarketUpdate update) {
        SubscriptionKey key = update.key();
        int delivered = 0;
        while (true) {
            KeyState state = keys.computeIfAbsent(key, k -> new KeyState());
            synchronized (state) {
                if (state.retired) {
                    continue;
                }
                if (state.latest != null && update.timestamp() < state.latest.timestamp()) {
                    metrics.recordStaleUpdate(key.topic().wireName());
                    log.debug("[BROADCAST] stale update for {} ts={} < {}", key, update.timestamp(), state.latest.timestamp());
                    return false;
                }
                state.latest = update;
                for (SubscriberHandle handle : registry.subscribersOf(key)) {
                    if (offer(handle, key, update)) delivered++;
                }
                break;
            }
        }
        metrics.recordPublish(key.topic().wireName());
        log.debug("[BROADCAST] {} ts={} -> {} subscribers", key, update.timestamp(), delivered);
        return true;
    }

    /**
     * Subscribe {@code handle} to {@code key} and, if the subscription is new,
     * hand it the key's latest update. Runs under the key's publish lock so the
     * primed update can never arrive after a newer one.
     *
     * @return true if the subscription is new
     */
    public boolean attach(SubscriberHandle handle, SubscriptionKey key) {
        while (true) {
            KeyState state = keys.computeIfAbsent(key, k -> new KeyState());
            synchronized (state) {
                if (state.retired) {
                    continue;
                }
                boolean added = registry.subscribe(handle, key);
                if (added && state.latest != null) {
                    offer(handle, key, state.latest);
                }
                return added;
            }
        }
    }

    public boolean detach(SubscriberHandle handle, SubscriptionKey key) {
        boolean removed = registry.unsubscribe(handle, key);
        if (removed) {
            retireIfIdle(key);
        }
        return removed;
    }

    /**
     * Remove every subscription of a connection.
     *
     * @return number of subscriptions removed
     */
    public int dropConnection(String connectionId) {
        Set<SubscriptionKey> subscribed = registry.subscriptionsOf(connectionId);
        int dropped = registry.dropConnection(connectionId);
        for (SubscriptionKey key : subscribed) {
            retireIfIdle(key);
        }
        return dropped;
    }

    public Optional<MarketUpdate> latest(SubscriptionKey key) {
        KeyState state = keys.get(key);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.ofNullable(state.latest);
        }
    }

    /**
     * Number of keys with per-key state.
     */
    int trackedKeys() {
        return keys.size();
    }

    /**
     * Forget a key that never saw an update once nobody subscribes to it.
     * Keys with a latest update are kept for stale detection and priming.
     */
    private void retireIfIdle(SubscriptionKey key) {
        KeyState state = keys.get(key);
        if (state == null) {
            return;
        }
        synchronized (state) {
            if (state.latest == null && registry.subscribersOf(key).isEmpty()) {
                state.retired = true;
                keys.remove(key, state);
            }
        }
    }

    private boolean offer(SubscriberHandle handle, SubscriptionKey key, MarketUpdate update) {
        OfferResult result = handle.deliver(update);
        metrics.recordEnqueue(result);
        if (result == OfferResult.REJECTED) {
            // connection is closing; make sure it stops being a target
            registry.unsubscribe(handle.connectionId(), key);
            return false;
        }
        return true;
    }

    private static final class KeyState {
        private MarketUpdate latest;
        // set once removed from the map; holders must look the key up again
        private boolean retired;
    }
}

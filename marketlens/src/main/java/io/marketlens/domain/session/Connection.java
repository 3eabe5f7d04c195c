package io.marketlens.domain.session;

import io.marketlens.domain.data.MarketUpdate;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live client connection.
 *
 * State transitions are made by the Gateway only. Other components see the
 * connection through {@link SubscriberHandle}.
 */
public final class Connection implements SubscriberHandle {

    private final String connectionId;
    private final String remoteAddress;
    private final Instant connectedAt;
    private final OutboundBuffer outbound;
    private final Clock clock;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    private volatile String principal;
    private volatile Instant lastActivity;   // volatile: written by I/O threads, read by the drain sweeper
    private volatile Instant drainStartedAt;

    public Connection(String connectionId, String remoteAddress, int outboundCapacity, Clock clock) {
        this.connectionId = connectionId;
        this.remoteAddress = remoteAddress;
        this.outbound = new OutboundBuffer(outboundCapacity);
        this.clock = clock;
        this.connectedAt = clock.instant();
        this.lastActivity = connectedAt;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public OfferResult deliver(MarketUpdate update) {
        if (!state.get().acceptsDelivery()) {
            return OfferResult.REJECTED;
        }
        return outbound.offer(update);
    }

    public ConnectionState state() {
        return state.get();
    }

    /**
     * Atomically move from {@code expected} to {@code next}.
     *
     * @return false if the connection was not in {@code expected}
     * @throws IllegalStateException if the transition is not part of the lifecycle
     */
    public boolean transition(ConnectionState expected, ConnectionState next) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + expected + " -> " + next);
        }
        boolean moved = state.compareAndSet(expected, next);
        if (moved && next == ConnectionState.DRAINING) {
            drainStartedAt = clock.instant();
        }
        if (moved && next == ConnectionState.CLOSED) {
            outbound.close();
        }
        return moved;
    }

    public void authenticate(String principal) {
        this.principal = principal;
    }

    public String principal() {
        return principal;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public Instant drainStartedAt() {
        return drainStartedAt;
    }

    public void touch() {
        this.lastActivity = clock.instant();
    }

    public OutboundBuffer outbound() {
        return outbound;
    }

    public void trackInFlight(Future<?> task) {
        inFlight.add(task);
    }

    public void completeInFlight(Future<?> task) {
        inFlight.remove(task);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Cancel every analysis still running for this connection.
     *
     * @return number of tasks cancelled
     */
    public int cancelInFlight() {
        int cancelled = 0;
        for (Future<?> f : inFlight) {
            if (f.cancel(true)) cancelled++;
        }
        inFlight.clear();
        return cancelled;
    }

    @Override
    public String toString() {
        return "Connection{" + connectionId + ", principal=" + principal + ", state=" + state.get() + "}";
    }
}

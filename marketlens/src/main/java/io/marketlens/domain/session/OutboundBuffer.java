package io.marketlens.domain.session;

import io.marketlens.domain.data.MarketUpdate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded per-connection outbound queue with a drop-oldest overflow policy.
 *
 * Offers never block. Once closed the buffer rejects every offer and holds nothing.
 */
public final class OutboundBuffer {

    private final int capacity;
    private final ArrayDeque<MarketUpdate> queue;
    private long dropped;
    private boolean closed;

    public OutboundBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive");
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized OfferResult offer(MarketUpdate update) {
        if (closed) {
            return OfferResult.REJECTED;
        }
        if (queue.size() >= capacity) {
            queue.pollFirst();
            dropped++;
            queue.addLast(update);
            return OfferResult.DROPPED_OLDEST;
        }
        queue.addLast(update);
        return OfferResult.ACCEPTED;
    }

    /**
     * Remove up to {@code max} updates in FIFO order.
     */
    public synchronized List<MarketUpdate> drain(int max) {
        int n = Math.min(max, queue.size());
        List<MarketUpdate> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(queue.pollFirst());
        }
        return out;
    }

    public synchronized void close() {
        closed = true;
        queue.clear();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized long droppedCount() {
        return dropped;
    }

    public int capacity() {
        return capacity;
    }
}

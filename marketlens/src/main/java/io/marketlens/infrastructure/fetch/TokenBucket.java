package io.marketlens.infrastructure.fetch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket with lazy, continuous refill.
 *
 * Starts full. {@code refillTokens} tokens are added per {@code refillPeriod},
 * pro-rated, never exceeding {@code capacity}.
 */
public class TokenBucket {

    private final long capacity;
    private final long refillTokens;
    private final Duration refillPeriod;
    private final Clock clock;

    private double tokens;
    private Instant lastRefill;

    public TokenBucket(long capacity, long refillTokens, Duration refillPeriod, Clock clock) {
        if (capacity <= 0 || refillTokens <= 0) {
            throw new IllegalArgumentException("Bucket capacity and refill must be positive");
        }
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("Refill period must be positive");
        }
        this.capacity = capacity;
        this.refillTokens = refillTokens;
        this.refillPeriod = refillPeriod;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefill = clock.instant();
    }

    /**
     * Take one token if available. Never waits.
     */
    public synchronized boolean tryConsume() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    /**
     * Time until one whole token is available; zero if one already is.
     */
    public synchronized Duration timeUntilNextToken() {
        refill();
        if (tokens >= 1.0) {
            return Duration.ZERO;
        }
        long nanos = Math.round((1.0 - tokens) * refillPeriod.toNanos() / refillTokens);
        return Duration.ofNanos(nanos);
    }

    public long capacity() {
        return capacity;
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        if (elapsedNanos <= 0) {
            return;
        }
        double added = (double) elapsedNanos * refillTokens / refillPeriod.toNanos();
        tokens = Math.min(capacity, tokens + added);
        lastRefill = now;
    }
}

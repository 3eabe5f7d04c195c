package io.marketlens.infrastructure.fetch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Consecutive-failure circuit breaker with a single half-open probe.
 *
 * <pre>
 * CLOSED    --N consecutive failures-->  OPEN
 * OPEN      --cool-down elapsed------->  HALF_OPEN (first caller becomes the probe)
 * HALF_OPEN --probe succeeds---------->  CLOSED
 * HALF_OPEN --probe fails------------->  OPEN (fresh cool-down)
 * </pre>
 *
 * While the probe is in flight every other caller is denied.
 */
public class CircuitBreaker {

    public enum Permit {
        /** Circuit closed, normal call. */
        NORMAL,
        /** Caller is the single half-open trial call. */
        PROBE,
        /** Fail fast. */
        DENIED
    }

    private final int failureThreshold;
    private final Duration coolDown;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures = 0;
    private Instant lastFailureTime;
    private boolean probeInFlight = false;

    private CircuitBreaker(int failureThreshold, Duration coolDown, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    public synchronized Permit tryAcquire() {
        switch (state) {
            case CLOSED:
                return Permit.NORMAL;
            case OPEN:
                if (!clock.instant().isBefore(lastFailureTime.plus(coolDown))) {
                    state = CircuitState.HALF_OPEN;
                    probeInFlight = true;
                    return Permit.PROBE;
                }
                return Permit.DENIED;
            case HALF_OPEN:
                if (probeInFlight) {
                    return Permit.DENIED;
                }
                probeInFlight = true;
                return Permit.PROBE;
            default:
                return Permit.DENIED;
        }
    }

    /**
     * Upstream answered. In CLOSED this resets the failure count; otherwise only
     * the probe's answer closes the circuit, and a NORMAL call admitted before the
     * circuit opened changes nothing.
     */
    public synchronized void recordSuccess(Permit permit) {
        if (state == CircuitState.CLOSED) {
            consecutiveFailures = 0;
        } else if (permit == Permit.PROBE) {
            consecutiveFailures = 0;
            probeInFlight = false;
            state = CircuitState.CLOSED;
        }
    }

    /**
     * Upstream failed. Opens the circuit on the N-th consecutive failure in CLOSED,
     * or re-opens it with a fresh cool-down when the probe fails.
     */
    public synchronized void recordFailure(Permit permit) {
        if (state == CircuitState.CLOSED) {
            consecutiveFailures++;
            lastFailureTime = clock.instant();
            if (consecutiveFailures >= failureThreshold) {
                state = CircuitState.OPEN;
            }
        } else if (permit == Permit.PROBE) {
            consecutiveFailures++;
            lastFailureTime = clock.instant();
            probeInFlight = false;
            state = CircuitState.OPEN;
        }
    }

    /**
     * Time left before the next probe is allowed, or empty when the circuit is
     * not cooling down (closed, or a probe is already in flight).
     */
    public synchronized Optional<Duration> remainingCoolDown() {
        if (state != CircuitState.OPEN) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), lastFailureTime.plus(coolDown));
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * The call was abandoned without an upstream verdict (cancelled, or rejected by the
     * rate limiter after admission). Frees the probe slot so the next caller can probe.
     */
    public synchronized void release(Permit permit) {
        if (permit == Permit.PROBE) {
            probeInFlight = false;
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);
        private Clock clock = Clock.systemUTC();

        public Builder failureThreshold(int failureThreshold) {
            if (failureThreshold <= 0) {
                throw new IllegalArgumentException("Failure threshold must be positive");
            }
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder coolDown(Duration coolDown) {
            if (coolDown.isNegative() || coolDown.isZero()) {
                throw new IllegalArgumentException("Cool-down must be positive");
            }
            this.coolDown = coolDown;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(failureThreshold, coolDown, clock);
        }
    }
}

package io.marketlens.infrastructure.fetch;

import io.marketlens.domain.common.ErrorKind;

import java.time.Clock;

/**
 * Rate-limiter and circuit-breaker state for one external source.
 *
 * One instance per source, shared by every caller. Admission (circuit check
 * plus token take) happens under this object's lock so the two decisions are
 * atomic with respect to other callers of the same source.
 */
public final class SourceGuard {

    private final String source;
    private final TokenBucket bucket;
    private final CircuitBreaker breaker;

    public SourceGuard(String source, SourceLimits limits, Clock clock) {
        this.source = source;
        this.bucket = new TokenBucket(limits.burst(), limits.refillTokens(), limits.refillPeriod(), clock);
        this.breaker = CircuitBreaker.builder()
            .failureThreshold(limits.failureThreshold())
            .coolDown(limits.coolDown())
            .clock(clock)
            .build();
    }

    /**
     * Admit one call or fail fast. An open circuit is checked first so a
     * rejected call never spends a token.
     *
     * @throws FetchException CIRCUIT_OPEN or RATE_LIMITED
     */
    public synchronized CircuitBreaker.Permit admit() {
        CircuitBreaker.Permit permit = breaker.tryAcquire();
        if (permit == CircuitBreaker.Permit.DENIED) {
            throw new FetchException(source, ErrorKind.CIRCUIT_OPEN, "Circuit open for " + source,
                breaker.remainingCoolDown().orElse(null));
        }
        if (!bucket.tryConsume()) {
            breaker.release(permit);
            throw new FetchException(source, ErrorKind.RATE_LIMITED, "No tokens left for " + source,
                bucket.timeUntilNextToken());
        }
        return permit;
    }

    public void onSuccess(CircuitBreaker.Permit permit) {
        breaker.recordSuccess(permit);
    }

    public void onFailure(CircuitBreaker.Permit permit) {
        breaker.recordFailure(permit);
    }

    public void onAbandoned(CircuitBreaker.Permit permit) {
        breaker.release(permit);
    }

    public String source() {
        return source;
    }

    public CircuitState circuitState() {
        return breaker.getState();
    }

    public int consecutiveFailures() {
        return breaker.getConsecutiveFailures();
    }

    public double availableTokens() {
        return bucket.availableTokens();
    }
}

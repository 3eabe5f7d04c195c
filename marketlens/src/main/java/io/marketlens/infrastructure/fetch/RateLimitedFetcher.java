package io.marketlens.infrastructure.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.common.Deadline;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.infrastructure.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Admission control in front of every external call.
 *
 * Each registered source has exactly one {@link SourceGuard}. A call is
 * rejected without touching the upstream when its deadline already passed
 * (TIMEOUT), the circuit is open (CIRCUIT_OPEN) or no token is left
 * (RATE_LIMITED). Rejected calls are never queued; callers decide whether to retry.
 *
 * Cancellation of the calling thread surfaces as TIMEOUT. It counts against
 * the upstream only when the call's own deadline has passed.
 */
public final class RateLimitedFetcher {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedFetcher.class);

    private final Map<String, SourceGuard> guards = new ConcurrentHashMap<>();
    private final Map<String, UpstreamSource> upstreams = new ConcurrentHashMap<>();
    private final Clock clock;
    private final GatewayMetrics metrics;

    public RateLimitedFetcher(Clock clock, GatewayMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Register a source with an upstream for {@link #fetch}.
     */
    public void registerSource(String source, SourceLimits limits, UpstreamSource upstream) {
        registerGuard(source, limits);
        upstreams.put(source, upstream);
    }

    /**
     * Register a source used only through {@link #execute}.
     */
    public void registerGuard(String source, SourceLimits limits) {
        SourceGuard previous = guards.putIfAbsent(source, new SourceGuard(source, limits, clock));
        if (previous != null) {
            throw new IllegalStateException("Source already registered: " + source);
        }
        metrics.recordCircuitState(source, CircuitState.CLOSED);
        log.info("[FETCH] Registered source {} (burst={}, refill={}/{}s, threshold={}, coolDown={}s)",
            source, limits.burst(), limits.refillTokens(), limits.refillPeriod().toSeconds(),
            limits.failureThreshold(), limits.coolDown().toSeconds());
    }

    public JsonNode fetch(String source, FetchParams params, Deadline deadline) {
        UpstreamSource upstream = upstreams.get(source);
        if (upstream == null) {
            throw new IllegalArgumentException("No upstream registered for source: " + source);
        }
        return execute(source, deadline, d -> upstream.fetch(params, d));
    }

    /**
     * Run {@code call} under the source's admission control.
     *
     * @throws FetchException with kind TIMEOUT, CIRCUIT_OPEN, RATE_LIMITED or UPSTREAM_FAILURE
     */
    public <T> T execute(String source, Deadline deadline, GuardedCall<T> call) {
        SourceGuard guard = guards.get(source);
        if (guard == null) {
            throw new IllegalArgumentException("Unknown source: " + source);
        }
        if (deadline.isExpired()) {
            metrics.recordFetch(source, "timeout", Duration.ZERO);
            throw new FetchException(source, ErrorKind.TIMEOUT, "Deadline passed before call");
        }

        CircuitBreaker.Permit permit;
        try {
            permit = guard.admit();
        } catch (FetchException e) {
            metrics.recordFetch(source, e.getKind() == ErrorKind.RATE_LIMITED ? "rate_limited" : "circuit_open",
                Duration.ZERO);
            log.debug("[FETCH] {} rejected: {}", source, e.getKind());
            throw e;
        }

        long start = System.nanoTime();
        try {
            T result = call.call(deadline);
            guard.onSuccess(permit);
            metrics.recordFetch(source, "success", Duration.ofNanos(System.nanoTime() - start));
            if (permit == CircuitBreaker.Permit.PROBE) {
                log.info("[FETCH] {} probe succeeded, circuit closed", source);
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(source, guard, permit, deadline, start, e);
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                throw cancelled(source, guard, permit, deadline, start, e);
            }
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            guard.onFailure(permit);
            ErrorKind kind = isTimeout(e) ? ErrorKind.TIMEOUT : ErrorKind.UPSTREAM_FAILURE;
            metrics.recordFetch(source, kind == ErrorKind.TIMEOUT ? "timeout" : "failure", latency);
            logFailure(source, guard, e);
            throw new FetchException(source, kind, "Upstream call failed", e);
        } finally {
            if (permit == CircuitBreaker.Permit.PROBE) {
                metrics.recordCircuitState(source, guard.circuitState());
            }
        }
    }

    /**
     * The calling task was cancelled. If the call's own deadline has passed the
     * upstream was too slow and the failure counts; otherwise the caller gave up
     * (e.g. the client disconnected) and the upstream is not blamed.
     */
    private FetchException cancelled(String source, SourceGuard guard, CircuitBreaker.Permit permit,
                                     Deadline deadline, long start, Exception cause) {
        if (deadline.isExpired()) {
            guard.onFailure(permit);
            logFailure(source, guard, cause);
        } else {
            guard.onAbandoned(permit);
        }
        metrics.recordFetch(source, "timeout", Duration.ofNanos(System.nanoTime() - start));
        return new FetchException(source, ErrorKind.TIMEOUT, "Call cancelled", cause);
    }

    private void logFailure(String source, SourceGuard guard, Exception e) {
        CircuitState state = guard.circuitState();
        metrics.recordCircuitState(source, state);
        if (state == CircuitState.OPEN) {
            log.warn("[FETCH] {} circuit OPEN after {} consecutive failures: {}",
                source, guard.consecutiveFailures(), e.toString());
        } else {
            log.warn("[FETCH] {} call failed: {}", source, e.toString());
        }
    }

    private static boolean isTimeout(Exception e) {
        return e instanceof HttpTimeoutException || e instanceof TimeoutException;
    }

    public SourceGuard guard(String source) {
        return guards.get(source);
    }

    public Set<String> sources() {
        return Set.copyOf(guards.keySet());
    }
}

package io.marketlens.infrastructure.metrics;

import io.marketlens.domain.session.OfferResult;
import io.marketlens.infrastructure.fetch.CircuitState;

import java.time.Duration;

/**
 * Gateway metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or any other backend. Components
 * receive an instance through their constructor; {@link #noop()} is available
 * for wiring that does not care.
 */
public interface GatewayMetrics {

    /**
     * Record one guarded upstream call.
     *
     * @param source  source name
     * @param outcome success, rate_limited, circuit_open, timeout, failure
     * @param latency time spent in the call (zero for fast-fail)
     */
    void recordFetch(String source, String outcome, Duration latency);

    void recordCircuitState(String source, CircuitState state);

    void recordCacheLookup(String namespace, boolean hit);

    void recordPublish(String topic);

    void recordStaleUpdate(String topic);

    void recordEnqueue(OfferResult result);

    void recordConnectionEvent(String event);

    void setActiveConnections(int count);

    /**
     * @param outcome insight, or the error kind code
     */
    void recordAnalysis(String outcome, boolean partial, Duration latency);

    void recordReasoning(String backend, String outcome);

    void recordFeedPoll(String source, String outcome);

    static GatewayMetrics noop() {
        return NoopGatewayMetrics.INSTANCE;
    }
}

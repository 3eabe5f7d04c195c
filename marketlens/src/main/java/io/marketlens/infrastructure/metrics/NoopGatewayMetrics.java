package io.marketlens.infrastructure.metrics;

import io.marketlens.domain.session.OfferResult;
import io.marketlens.infrastructure.fetch.CircuitState;

import java.time.Duration;

final class NoopGatewayMetrics implements GatewayMetrics {

    static final NoopGatewayMetrics INSTANCE = new NoopGatewayMetrics();

    private NoopGatewayMetrics() {}

    @Override public void recordFetch(String source, String outcome, Duration latency) {}
    @Override public void recordCircuitState(String source, CircuitState state) {}
    @Override public void recordCacheLookup(String namespace, boolean hit) {}
    @Override public void recordPublish(String topic) {}
    @Override public void recordStaleUpdate(String topic) {}
    @Override public void recordEnqueue(OfferResult result) {}
    @Override public void recordConnectionEvent(String event) {}
    @Override public void setActiveConnections(int count) {}
    @Override public void recordAnalysis(String outcome, boolean partial, Duration latency) {}
    @Override public void recordReasoning(String backend, String outcome) {}
    @Override public void recordFeedPoll(String source, String outcome) {}
}

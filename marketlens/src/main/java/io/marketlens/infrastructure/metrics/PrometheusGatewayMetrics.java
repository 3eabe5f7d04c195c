package io.marketlens.infrastructure.metrics;

import io.marketlens.domain.session.OfferResult;
import io.marketlens.infrastructure.fetch.CircuitState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of {@link GatewayMetrics}.
 *
 * Key metrics:
 * - gateway_fetch_total{source, outcome} / gateway_fetch_latency_seconds{source}
 * - gateway_circuit_state{source} (0=closed, 1=half-open, 2=open)
 * - gateway_cache_lookups_total{namespace, result}
 * - gateway_updates_published_total{topic}, gateway_updates_stale_total{topic}
 * - gateway_updates_enqueued_total{result}
 * - gateway_connections_active, gateway_connection_events_total{event}
 * - gateway_analysis_total{outcome, partial} / gateway_analysis_latency_seconds
 * - gateway_reasoning_total{backend, outcome}
 * - gateway_feed_polls_total{source, outcome}
 *
 * Exposed at /metrics by {@link PrometheusMetricsHandler}.
 */
public class PrometheusGatewayMetrics implements GatewayMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusGatewayMetrics.class);

    private final CollectorRegistry registry;

    private final Counter fetchCounter;
    private final Histogram fetchLatency;
    private final Gauge circuitState;
    private final Counter cacheLookups;
    private final Counter publishedCounter;
    private final Counter staleCounter;
    private final Counter enqueueCounter;
    private final Gauge activeConnections;
    private final Counter connectionEvents;
    private final Counter analysisCounter;
    private final Histogram analysisLatency;
    private final Counter reasoningCounter;
    private final Counter feedPollCounter;

    public PrometheusGatewayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusGatewayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.fetchCounter = Counter.build()
            .name("gateway_fetch_total")
            .help("Guarded upstream calls by outcome")
            .labelNames("source", "outcome")
            .register(registry);

        this.fetchLatency = Histogram.build()
            .name("gateway_fetch_latency_seconds")
            .help("Upstream call latency in seconds")
            .labelNames("source")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.circuitState = Gauge.build()
            .name("gateway_circuit_state")
            .help("Circuit breaker state (0=closed, 1=half-open, 2=open)")
            .labelNames("source")
            .register(registry);

        this.cacheLookups = Counter.build()
            .name("gateway_cache_lookups_total")
            .help("Cache lookups by result")
            .labelNames("namespace", "result")
            .register(registry);

        this.publishedCounter = Counter.build()
            .name("gateway_updates_published_total")
            .help("Market updates accepted for fan-out")
            .labelNames("topic")
            .register(registry);

        this.staleCounter = Counter.build()
            .name("gateway_updates_stale_total")
            .help("Market updates rejected because they were older than the last published one")
            .labelNames("topic")
            .register(registry);

        this.enqueueCounter = Counter.build()
            .name("gateway_updates_enqueued_total")
            .help("Per-connection enqueue results")
            .labelNames("result")
            .register(registry);

        this.activeConnections = Gauge.build()
            .name("gateway_connections_active")
            .help("Currently open client connections")
            .register(registry);

        this.connectionEvents = Counter.build()
            .name("gateway_connection_events_total")
            .help("Connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.analysisCounter = Counter.build()
            .name("gateway_analysis_total")
            .help("Analysis requests by outcome")
            .labelNames("outcome", "partial")
            .register(registry);

        this.analysisLatency = Histogram.build()
            .name("gateway_analysis_latency_seconds")
            .help("End-to-end analysis latency in seconds")
            .buckets(0.1, 0.25, 0.5, 1.0, 2.0, 4.0, 8.0, 15.0, 30.0)
            .register(registry);

        this.reasoningCounter = Counter.build()
            .name("gateway_reasoning_total")
            .help("Reasoning backend calls by outcome")
            .labelNames("backend", "outcome")
            .register(registry);

        this.feedPollCounter = Counter.build()
            .name("gateway_feed_polls_total")
            .help("Feed polls by outcome")
            .labelNames("source", "outcome")
            .register(registry);

        log.info("[PrometheusGatewayMetrics] Initialized");
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordFetch(String source, String outcome, Duration latency) {
        fetchCounter.labels(source, outcome).inc();
        if (!latency.isZero()) {
            fetchLatency.labels(source).observe(latency.toNanos() / 1_000_000_000.0);
        }
    }

    @Override
    public void recordCircuitState(String source, CircuitState state) {
        double value = switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
        circuitState.labels(source).set(value);
    }

    @Override
    public void recordCacheLookup(String namespace, boolean hit) {
        cacheLookups.labels(namespace, hit ? "hit" : "miss").inc();
    }

    @Override
    public void recordPublish(String topic) {
        publishedCounter.labels(topic).inc();
    }

    @Override
    public void recordStaleUpdate(String topic) {
        staleCounter.labels(topic).inc();
    }

    @Override
    public void recordEnqueue(OfferResult result) {
        enqueueCounter.labels(result.name().toLowerCase()).inc();
    }

    @Override
    public void recordConnectionEvent(String event) {
        connectionEvents.labels(event).inc();
    }

    @Override
    public void setActiveConnections(int count) {
        activeConnections.set(count);
    }

    @Override
    public void recordAnalysis(String outcome, boolean partial, Duration latency) {
        analysisCounter.labels(outcome, String.valueOf(partial)).inc();
        analysisLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordReasoning(String backend, String outcome) {
        reasoningCounter.labels(backend, outcome).inc();
    }

    @Override
    public void recordFeedPoll(String source, String outcome) {
        feedPollCounter.labels(source, outcome).inc();
    }
}

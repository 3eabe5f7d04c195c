package io.marketlens.config;

import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.infrastructure.fetch.SourceLimits;
import io.marketlens.service.feed.FeedSubscription;
import io.marketlens.util.Env;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable process configuration, read once at startup.
 */
public record GatewayConfig(
    int port,
    boolean productionMode,

    // Delivery
    Duration flushInterval,
    int outboundBufferCapacity,
    int deliveryBatchMax,
    Duration drainTimeout,

    // Analysis
    Duration defaultDeadline,
    Duration maxDeadline,
    Duration localReasoningBudget,
    int analysisThreads,
    int analyzerThreads,
    int reasoningThreads,
    Map<AnalysisKind, Duration> analysisTtls,
    Duration cacheSweepInterval,

    // Upstream protection
    int circuitFailureThreshold,
    Duration circuitCoolDown,
    int analyzerRatePerMinute,
    int reasoningRatePerMinute,
    int alphaVantageRequestsPerMinute,
    int newsApiRequestsPerHour,

    // Collaborators
    String gatewayTokens,
    String analysisServiceUrl,
    String localReasoningUrl,
    String cloudReasoningUrl,
    String feedServiceUrl,
    List<FeedSubscription> feeds,
    Duration feedPollInterval,

    FeatureFlags features
) {

    public GatewayConfig {
        analysisTtls = Map.copyOf(analysisTtls);
        feeds = List.copyOf(feeds);
    }

    public static GatewayConfig fromEnv() {
        Map<AnalysisKind, Duration> ttls = new EnumMap<>(AnalysisKind.class);
        ttls.put(AnalysisKind.TECHNICAL, Env.getMillis("TTL_TECHNICAL_MS", 60_000));
        ttls.put(AnalysisKind.PATTERN, Env.getMillis("TTL_PATTERN_MS", 300_000));
        ttls.put(AnalysisKind.SENTIMENT, Env.getMillis("TTL_SENTIMENT_MS", 900_000));

        return new GatewayConfig(
            Env.getInt("PORT", 9090),
            Env.getBool("PRODUCTION_MODE", false),

            Env.getMillis("WS_FLUSH_MS", 50),
            Env.getInt("OUTBOUND_BUFFER_CAPACITY", 1024),
            Env.getInt("DELIVERY_BATCH_MAX", 256),
            Env.getMillis("DRAIN_TIMEOUT_MS", 5_000),

            Env.getMillis("DEFAULT_DEADLINE_MS", 8_000),
            Env.getMillis("MAX_DEADLINE_MS", 30_000),
            Env.getMillis("LOCAL_REASONING_BUDGET_MS", 3_000),
            Env.getInt("ANALYSIS_THREADS", 16),
            Env.getInt("ANALYZER_THREADS", 32),
            Env.getInt("REASONING_THREADS", 16),
            ttls,
            Env.getMillis("CACHE_SWEEP_MS", 60_000),

            Env.getInt("CIRCUIT_FAILURE_THRESHOLD", 5),
            Env.getMillis("CIRCUIT_COOLDOWN_MS", 30_000),
            Env.getInt("ANALYZER_RATE_PER_MINUTE", 600),
            Env.getInt("REASONING_RATE_PER_MINUTE", 120),
            Env.getInt("ALPHA_VANTAGE_REQUESTS_PER_MINUTE", 5),
            Env.getInt("NEWS_API_REQUESTS_PER_HOUR", 100),

            Env.get("GATEWAY_TOKENS", ""),
            Env.get("ANALYSIS_SERVICE_URL", "http://localhost:8001"),
            Env.get("LOCAL_REASONING_URL", "http://localhost:11434"),
            Env.get("CLOUD_REASONING_URL", "http://localhost:8002"),
            Env.get("FEED_SERVICE_URL", "http://localhost:8003"),
            FeedSubscription.parseList(Env.get("FEEDS", "")),
            Env.getMillis("FEED_POLL_MS", 15_000),

            FeatureFlags.fromEnv());
    }

    public Duration ttlFor(AnalysisKind kind) {
        return analysisTtls.get(kind);
    }

    public SourceLimits analyzerLimits() {
        return SourceLimits.perMinute(analyzerRatePerMinute, circuitFailureThreshold, circuitCoolDown);
    }

    public SourceLimits reasoningLimits() {
        return SourceLimits.perMinute(reasoningRatePerMinute, circuitFailureThreshold, circuitCoolDown);
    }

    public SourceLimits alphaVantageLimits() {
        return SourceLimits.perMinute(alphaVantageRequestsPerMinute, circuitFailureThreshold, circuitCoolDown);
    }

    public SourceLimits newsApiLimits() {
        return SourceLimits.perHour(newsApiRequestsPerHour, circuitFailureThreshold, circuitCoolDown);
    }
}

package io.marketlens.bootstrap;

import io.marketlens.config.GatewayConfig;
import io.marketlens.domain.analysis.AnalysisKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Startup configuration validator.
 *
 * Called from App.main() before anything is wired. Throws
 * IllegalStateException on invalid configuration and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(GatewayConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", config.productionMode());

        requirePositive("PORT", config.port());
        requirePositive("OUTBOUND_BUFFER_CAPACITY", config.outboundBufferCapacity());
        requirePositive("DELIVERY_BATCH_MAX", config.deliveryBatchMax());
        requirePositive("CIRCUIT_FAILURE_THRESHOLD", config.circuitFailureThreshold());
        requirePositive("ANALYZER_RATE_PER_MINUTE", config.analyzerRatePerMinute());
        requirePositive("REASONING_RATE_PER_MINUTE", config.reasoningRatePerMinute());
        requirePositive("ALPHA_VANTAGE_REQUESTS_PER_MINUTE", config.alphaVantageRequestsPerMinute());
        requirePositive("NEWS_API_REQUESTS_PER_HOUR", config.newsApiRequestsPerHour());
        requirePositive("ANALYSIS_THREADS", config.analysisThreads());
        requirePositive("ANALYZER_THREADS", config.analyzerThreads());
        requirePositive("REASONING_THREADS", config.reasoningThreads());

        requirePositive("WS_FLUSH_MS", config.flushInterval());
        requirePositive("DRAIN_TIMEOUT_MS", config.drainTimeout());
        requirePositive("CIRCUIT_COOLDOWN_MS", config.circuitCoolDown());
        requirePositive("CACHE_SWEEP_MS", config.cacheSweepInterval());
        requirePositive("FEED_POLL_MS", config.feedPollInterval());
        for (AnalysisKind kind : AnalysisKind.analyzerKinds()) {
            requirePositive("TTL_" + kind.name() + "_MS", config.ttlFor(kind));
        }

        if (config.localReasoningBudget().isNegative() || config.localReasoningBudget().isZero()
            || config.localReasoningBudget().compareTo(config.defaultDeadline()) >= 0) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: LOCAL_REASONING_BUDGET_MS must be positive and below DEFAULT_DEADLINE_MS\n" +
                "Local: " + config.localReasoningBudget().toMillis() + "ms, default deadline: " +
                config.defaultDeadline().toMillis() + "ms\n" +
                "The cloud fallback needs some of the request budget.");
        }
        if (config.defaultDeadline().compareTo(config.maxDeadline()) > 0) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: DEFAULT_DEADLINE_MS (" + config.defaultDeadline().toMillis() +
                ") exceeds MAX_DEADLINE_MS (" + config.maxDeadline().toMillis() + ")");
        }
        log.info("✓ Deadlines: local {}ms, default {}ms, max {}ms",
            config.localReasoningBudget().toMillis(), config.defaultDeadline().toMillis(),
            config.maxDeadline().toMillis());

        if (config.productionMode()) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateProductionMode(GatewayConfig config) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");
        if (config.gatewayTokens() == null || config.gatewayTokens().isBlank()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires GATEWAY_TOKENS\n" +
                "System refuses to start.\n" +
                "Either:\n" +
                "  1. Configure client tokens: GATEWAY_TOKENS=token:principal,...\n" +
                "  2. Set PRODUCTION_MODE=false for local testing");
        }
        log.info("✓ Gateway tokens configured");
    }

    private static void warnNonProductionMode(GatewayConfig config) {
        if (config.gatewayTokens() == null || config.gatewayTokens().isBlank()) {
            log.warn("⚠️ No GATEWAY_TOKENS configured - every connection will be rejected");
        }
        if (config.feeds().isEmpty()) {
            log.warn("⚠️ No FEEDS configured - no market updates will be published");
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + key + " must be positive, got " + value);
        }
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + key + " must be positive, got " + value);
        }
    }

    private StartupConfigValidator() {}
}

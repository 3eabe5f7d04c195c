package io.marketlens.config;

import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.util.Env;

/**
 * Runtime feature switches.
 *
 * AI insights gate the whole analyze action; pattern and sentiment gate their
 * analyzer kinds; real-time updates gate subscriptions.
 */
public record FeatureFlags(
    boolean aiInsights,
    boolean patternRecognition,
    boolean sentimentAnalysis,
    boolean realTimeUpdates
) {

    public static FeatureFlags allEnabled() {
        return new FeatureFlags(true, true, true, true);
    }

    public static FeatureFlags fromEnv() {
        return new FeatureFlags(
            Env.getBool("ENABLE_AI_INSIGHTS", true),
            Env.getBool("ENABLE_PATTERN_RECOGNITION", true),
            Env.getBool("ENABLE_SENTIMENT_ANALYSIS", true),
            Env.getBool("ENABLE_REAL_TIME_UPDATES", true));
    }

    public boolean isEnabled(AnalysisKind kind) {
        return switch (kind) {
            case TECHNICAL -> true;
            case PATTERN -> patternRecognition;
            case SENTIMENT -> sentimentAnalysis;
            case AI_INSIGHT -> aiInsights;
        };
    }
}

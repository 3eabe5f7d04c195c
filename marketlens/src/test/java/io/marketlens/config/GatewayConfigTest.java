package io.marketlens.config;

import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.infrastructure.fetch.SourceLimits;
import io.marketlens.testing.Configs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("FEEDS");
        System.clearProperty("LOCAL_REASONING_BUDGET_MS");
        System.clearProperty("ENABLE_SENTIMENT_ANALYSIS");
    }

    @Test
    void testFromEnvReadsSystemPropertyOverrides() {
        System.setProperty("FEEDS", "ohlcv:EURUSD:1m:alpha_vantage,news:TSLA:1h:news_api");
        System.setProperty("LOCAL_REASONING_BUDGET_MS", "2500");
        System.setProperty("ENABLE_SENTIMENT_ANALYSIS", "false");

        GatewayConfig config = GatewayConfig.fromEnv();

        assertEquals(2, config.feeds().size());
        assertEquals("news_api", config.feeds().get(1).source());
        assertEquals(Duration.ofMillis(2_500), config.localReasoningBudget());
        assertFalse(config.features().sentimentAnalysis());
        assertFalse(config.features().isEnabled(AnalysisKind.SENTIMENT));
        assertTrue(config.features().isEnabled(AnalysisKind.TECHNICAL), "Technical analysis is always on");
    }

    @Test
    void testSourceLimits() {
        GatewayConfig config = Configs.valid();

        SourceLimits news = config.newsApiLimits();
        assertEquals(100, news.burst());
        assertEquals(Duration.ofHours(1), news.refillPeriod());

        SourceLimits prices = config.alphaVantageLimits();
        assertEquals(5, prices.refillTokens());
        assertEquals(Duration.ofMinutes(1), prices.refillPeriod());
        assertEquals(5, prices.failureThreshold());
        assertEquals(Duration.ofSeconds(30), prices.coolDown());
        assertEquals(Duration.ofMinutes(5), config.ttlFor(AnalysisKind.PATTERN));
    }
}

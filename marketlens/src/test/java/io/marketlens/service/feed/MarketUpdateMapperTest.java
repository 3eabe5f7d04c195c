package io.marketlens.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketlens.domain.data.MarketUpdate;
import io.marketlens.domain.data.NewsItem;
import io.marketlens.domain.data.Ohlcv;
import io.marketlens.domain.data.TickQuote;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketUpdateMapperTest {

    private final ObjectMapper json = new ObjectMapper();
    private final MarketUpdateMapper mapper = new MarketUpdateMapper();

    @Test
    void testOhlcvArraySortedAndInvalidSkipped() throws Exception {
        JsonNode raw = json.readTree("""
            [
              {"timestamp": 2000, "open": "1.10", "high": "1.12", "low": "1.09", "close": "1.11", "volume": 10},
              {"timestamp": 1000, "open": 1.08, "high": 1.10, "low": 1.07, "close": 1.09, "volume": 5},
              {"timestamp": 3000, "open": "1.10", "high": "1.00", "low": "1.09", "close": "1.11", "volume": 1},
              {"open": "1.10", "high": "1.12", "low": "1.09", "close": "1.11", "volume": 1}
            ]
            """);

        List<MarketUpdate> updates = mapper.map(FeedSubscription.parse("ohlcv:EURUSD:1m:alpha_vantage"), raw);

        assertEquals(2, updates.size(), "High below low and missing timestamp are skipped");
        assertEquals(1000, updates.get(0).timestamp());
        assertEquals(2000, updates.get(1).timestamp());
        assertEquals(new BigDecimal("1.11"), ((Ohlcv) updates.get(1).payload()).close());
        assertEquals("EURUSD", updates.get(0).symbol());
    }

    @Test
    void testSingleTickWithIsoTimestamp() throws Exception {
        JsonNode raw = json.readTree("""
            {"timestamp": "2024-01-15T10:00:00Z", "lastPrice": "187.50", "bid": "187.49", "volume": 1200}
            """);

        List<MarketUpdate> updates = mapper.map(FeedSubscription.parse("tick:AAPL:1m:alpha_vantage"), raw);

        assertEquals(1, updates.size());
        assertEquals(Instant.parse("2024-01-15T10:00:00Z").toEpochMilli(), updates.get(0).timestamp());
        TickQuote tick = (TickQuote) updates.get(0).payload();
        assertEquals(new BigDecimal("187.50"), tick.lastPrice());
        assertNull(tick.ask());
        assertEquals(1200, tick.volume());
    }

    @Test
    void testNewsItem() throws Exception {
        JsonNode raw = json.readTree("""
            [{"timestamp": "1705312800000", "headline": "Tesla beats estimates", "source": "Reuters"}]
            """);

        List<MarketUpdate> updates = mapper.map(FeedSubscription.parse("news:TSLA:1h:news_api"), raw);

        assertEquals(1, updates.size());
        assertEquals(1705312800000L, updates.get(0).timestamp());
        assertEquals("Tesla beats estimates", ((NewsItem) updates.get(0).payload()).headline());
    }

    @Test
    void testEmptyInputs() {
        FeedSubscription feed = FeedSubscription.parse("ohlcv:AAPL:1m:alpha_vantage");

        assertTrue(mapper.map(feed, null).isEmpty());
        assertTrue(mapper.map(feed, json.nullNode()).isEmpty());
        assertTrue(mapper.map(feed, json.createArrayNode()).isEmpty());
    }
}

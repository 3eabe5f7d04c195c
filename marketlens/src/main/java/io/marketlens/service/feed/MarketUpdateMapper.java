package io.marketlens.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.data.MarketPayload;
import io.marketlens.domain.data.MarketUpdate;
import io.marketlens.domain.data.NewsItem;
import io.marketlens.domain.data.Ohlcv;
import io.marketlens.domain.data.TickQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Normalizes raw feed JSON into {@link MarketUpdate}s.
 *
 * Items must carry a {@code timestamp} (epoch millis or ISO-8601). Decimal
 * fields are read as strings or numbers. Invalid items are skipped and logged.
 */
public final class MarketUpdateMapper {
    private static final Logger log = LoggerFactory.getLogger(MarketUpdateMapper.class);

    /**
     * @return valid updates in ascending timestamp order
     */
    public List<MarketUpdate> map(FeedSubscription feed, JsonNode raw) {
        List<MarketUpdate> updates = new ArrayList<>();
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return updates;
        }
        if (raw.isArray()) {
            for (JsonNode item : raw) {
                mapItem(feed, item, updates);
            }
        } else {
            mapItem(feed, raw, updates);
        }
        updates.sort(Comparator.comparingLong(MarketUpdate::timestamp));
        return updates;
    }

    private void mapItem(FeedSubscription feed, JsonNode item, List<MarketUpdate> out) {
        try {
            out.add(new MarketUpdate(feed.symbol(), feed.timeframe(), timestamp(item), payload(feed, item)));
        } catch (IllegalArgumentException e) {
            log.warn("[FEED] Skipping invalid {} item: {}", feed, e.getMessage());
        }
    }

    private static MarketPayload payload(FeedSubscription feed, JsonNode item) {
        return switch (feed.topic()) {
            case OHLCV -> new Ohlcv(
                decimal(item, "open"),
                decimal(item, "high"),
                decimal(item, "low"),
                decimal(item, "close"),
                decimal(item, "volume"));
            case TICK -> new TickQuote(
                decimal(item, "lastPrice"),
                decimal(item, "bid"),
                decimal(item, "ask"),
                item.path("volume").asLong(0));
            case NEWS -> new NewsItem(
                text(item, "headline"),
                text(item, "source"),
                text(item, "url"));
        };
    }

    static long timestamp(JsonNode item) {
        JsonNode ts = item.get("timestamp");
        if (ts == null || ts.isNull()) {
            throw new IllegalArgumentException("Missing timestamp");
        }
        if (ts.isNumber()) {
            return ts.asLong();
        }
        String s = ts.asText().trim();
        try {
            return Instant.parse(s).toEpochMilli();
        } catch (DateTimeParseException e) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("Unparseable timestamp: " + s);
            }
        }
    }

    private static BigDecimal decimal(JsonNode item, String field) {
        JsonNode v = item.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isNumber()) {
            return v.decimalValue();
        }
        try {
            return new BigDecimal(v.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + field + "' is not a number: " + v.asText());
        }
    }

    private static String text(JsonNode item, String field) {
        JsonNode v = item.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}

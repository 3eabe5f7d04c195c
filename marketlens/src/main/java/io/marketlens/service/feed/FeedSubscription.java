package io.marketlens.service.feed;

import io.marketlens.domain.data.SubscriptionKey;
import io.marketlens.domain.data.Timeframe;
import io.marketlens.domain.data.Topic;

import java.util.ArrayList;
import java.util.List;

/**
 * One configured feed: poll {@code source} for (topic, symbol, timeframe).
 */
public record FeedSubscription(Topic topic, String symbol, Timeframe timeframe, String source) {

    public FeedSubscription {
        if (topic == null || symbol == null || symbol.isBlank() || timeframe == null
            || source == null || source.isBlank()) {
            throw new IllegalArgumentException("topic, symbol, timeframe and source are required");
        }
    }

    public SubscriptionKey key() {
        return new SubscriptionKey(topic, symbol, timeframe);
    }

    /**
     * Parse {@code topic:symbol:timeframe:source}. The symbol may itself contain
     * colons (e.g. {@code NSE:INFY}); topic is the first field and timeframe and
     * source the last two.
     */
    public static FeedSubscription parse(String raw) {
        String[] parts = raw == null ? new String[0] : raw.trim().split(":");
        if (parts.length < 4) {
            throw new IllegalArgumentException("Invalid feed entry (expected topic:symbol:timeframe:source): " + raw);
        }
        String symbol = String.join(":", List.of(parts).subList(1, parts.length - 2));
        return new FeedSubscription(
            Topic.fromWire(parts[0]),
            symbol.toUpperCase(),
            Timeframe.parse(parts[parts.length - 2]),
            parts[parts.length - 1].trim());
    }

    /**
     * Parse a comma-separated list; blank input yields an empty list.
     */
    public static List<FeedSubscription> parseList(String raw) {
        List<FeedSubscription> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String s : raw.split(",")) {
            if (!s.isBlank()) out.add(parse(s));
        }
        return out;
    }

    @Override
    public String toString() {
        return topic.wireName() + ":" + symbol + ":" + timeframe.code() + "@" + source;
    }
}

package io.marketlens.domain.data;

/**
 * Normalized, immutable market update.
 *
 * @param timestamp source-supplied epoch millis; non-decreasing per key
 */
public record MarketUpdate(String symbol, Timeframe timeframe, long timestamp, MarketPayload payload) {

    public MarketUpdate {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (timeframe == null || payload == null) {
            throw new IllegalArgumentException("timeframe and payload are required");
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative");
        }
    }

    public Topic topic() {
        return payload.topic();
    }

    public SubscriptionKey key() {
        return new SubscriptionKey(payload.topic(), symbol, timeframe);
    }
}

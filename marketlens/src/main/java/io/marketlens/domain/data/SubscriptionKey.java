package io.marketlens.domain.data;

/**
 * Routing key shared by subscriptions and updates.
 */
public record SubscriptionKey(Topic topic, String symbol, Timeframe timeframe) {

    public SubscriptionKey {
        if (topic == null || symbol == null || symbol.isBlank() || timeframe == null) {
            throw new IllegalArgumentException("topic, symbol and timeframe are required");
        }
    }

    @Override
    public String toString() {
        return topic.wireName() + ":" + symbol + ":" + timeframe.code();
    }
}

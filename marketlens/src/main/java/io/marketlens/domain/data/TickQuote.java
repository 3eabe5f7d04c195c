package io.marketlens.domain.data;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;

/**
 * Real-time tick. Bid/ask are optional.
 */
public record TickQuote(
    BigDecimal lastPrice,
    BigDecimal bid,
    BigDecimal ask,
    long volume
) implements MarketPayload {

    public TickQuote {
        if (lastPrice == null || lastPrice.signum() <= 0) {
            throw new IllegalArgumentException("Tick lastPrice must be positive");
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Tick volume cannot be negative");
        }
    }

    @Override
    public Topic topic() {
        return Topic.TICK;
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("lastPrice", lastPrice.toPlainString());
        if (bid != null) o.put("bid", bid.toPlainString());
        if (ask != null) o.put("ask", ask.toPlainString());
        o.put("volume", volume);
        return o;
    }
}

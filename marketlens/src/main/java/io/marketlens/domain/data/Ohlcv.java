package io.marketlens.domain.data;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;

/**
 * Validated OHLCV candle.
 *
 * Prices must be positive, volume non-negative, high >= low, and open/close
 * within [low, high].
 */
public record Ohlcv(
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume
) implements MarketPayload {

    public Ohlcv {
        if (open == null || high == null || low == null || close == null || volume == null) {
            throw new IllegalArgumentException("Missing OHLCV field");
        }
        if (open.signum() <= 0 || high.signum() <= 0 || low.signum() <= 0 || close.signum() <= 0) {
            throw new IllegalArgumentException("All prices must be positive");
        }
        if (volume.signum() < 0) {
            throw new IllegalArgumentException("Volume cannot be negative");
        }
        if (high.compareTo(low) < 0) {
            throw new IllegalArgumentException("High (" + high + ") must be >= Low (" + low + ")");
        }
        if (open.compareTo(high) > 0 || open.compareTo(low) < 0) {
            throw new IllegalArgumentException("Open (" + open + ") must be between Low and High");
        }
        if (close.compareTo(high) > 0 || close.compareTo(low) < 0) {
            throw new IllegalArgumentException("Close (" + close + ") must be between Low and High");
        }
    }

    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    @Override
    public Topic topic() {
        return Topic.OHLCV;
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("open", open.toPlainString());
        o.put("high", high.toPlainString());
        o.put("low", low.toPlainString());
        o.put("close", close.toPlainString());
        o.put("volume", volume.toPlainString());
        return o;
    }
}

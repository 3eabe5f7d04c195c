package io.marketlens.domain.data;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Body of a {@link MarketUpdate}: a candle, a tick or a news item.
 */
public interface MarketPayload {

    Topic topic();

    ObjectNode toJson();
}

package io.marketlens.domain.session;

import io.marketlens.domain.data.MarketUpdate;

/**
 * Non-owning view of a connection used for delivery.
 * Holders may enqueue updates but cannot change connection state.
 */
public interface SubscriberHandle {

    String connectionId();

    OfferResult deliver(MarketUpdate update);
}

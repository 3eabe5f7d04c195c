package io.marketlens.domain.session;

public enum OfferResult {
    ACCEPTED,
    /** Buffer was full; the oldest queued update was discarded to make room. */
    DROPPED_OLDEST,
    /** Connection no longer accepts delivery. Nothing was queued. */
    REJECTED
}

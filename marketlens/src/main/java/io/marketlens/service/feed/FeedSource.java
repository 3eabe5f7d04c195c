package io.marketlens.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.common.Deadline;
import io.marketlens.infrastructure.fetch.FetchParams;
import io.marketlens.infrastructure.fetch.UpstreamSource;

/**
 * External price or news feed, polled for the latest data of one symbol.
 *
 * Returns either a single raw item or an array of items; {@link MarketUpdateMapper}
 * turns them into updates. The params carry {@code topic} and {@code timeframe}.
 */
public interface FeedSource {

    /** Fetcher source name, also used in {@code FEEDS} entries. */
    String name();

    JsonNode poll(FetchParams params, Deadline deadline) throws Exception;

    default UpstreamSource asUpstream() {
        return this::poll;
    }
}

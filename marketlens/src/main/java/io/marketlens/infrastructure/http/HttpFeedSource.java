package io.marketlens.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.common.Deadline;
import io.marketlens.infrastructure.fetch.FetchParams;
import io.marketlens.service.feed.FeedSource;

import java.util.HashMap;
import java.util.Map;

/**
 * Feed served over HTTP: {@code GET /feeds/<name>?symbol=..&topic=..&timeframe=..}.
 */
public final class HttpFeedSource implements FeedSource {

    private final String name;
    private final HttpJsonClient client;

    public HttpFeedSource(String name, HttpJsonClient client) {
        this.name = name;
        this.client = client;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public JsonNode poll(FetchParams params, Deadline deadline) throws Exception {
        Map<String, String> query = new HashMap<>(params.params());
        query.put("symbol", params.symbol());
        return client.get("/feeds/" + name, query, deadline);
    }
}

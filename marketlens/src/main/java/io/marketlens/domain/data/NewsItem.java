package io.marketlens.domain.data;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Headline from a news feed.
 */
public record NewsItem(String headline, String source, String url) implements MarketPayload {

    public NewsItem {
        if (headline == null || headline.isBlank()) {
            throw new IllegalArgumentException("News headline is required");
        }
    }

    @Override
    public Topic topic() {
        return Topic.NEWS;
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("headline", headline);
        if (source != null) o.put("source", source);
        if (url != null) o.put("url", url);
        return o;
    }
}

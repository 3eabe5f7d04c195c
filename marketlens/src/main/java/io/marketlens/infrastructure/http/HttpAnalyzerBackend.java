package io.marketlens.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.domain.common.Deadline;
import io.marketlens.service.analysis.AnalyzerBackend;

import java.util.Map;

/**
 * Analyzer served by an HTTP analysis service:
 * {@code POST /analyze/<kind>} with {@code {symbol, params}}, response body is the result.
 */
public final class HttpAnalyzerBackend implements AnalyzerBackend {

    private final AnalysisKind kind;
    private final HttpJsonClient client;

    public HttpAnalyzerBackend(AnalysisKind kind, HttpJsonClient client) {
        if (!kind.isAnalyzer()) {
            throw new IllegalArgumentException(kind + " is not served by an analyzer");
        }
        this.kind = kind;
        this.client = client;
    }

    @Override
    public AnalysisKind kind() {
        return kind;
    }

    @Override
    public JsonNode analyze(String symbol, Map<String, String> params, Deadline deadline) throws Exception {
        ObjectNode body = client.mapper().createObjectNode();
        body.put("symbol", symbol);
        ObjectNode p = body.putObject("params");
        params.forEach(p::put);
        return client.post("/analyze/" + kind.wireName(), body, deadline);
    }
}

package io.marketlens.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.analysis.ContextBundle;
import io.marketlens.domain.analysis.Outlook;
import io.marketlens.domain.analysis.ReasoningOutput;
import io.marketlens.domain.common.Deadline;
import io.marketlens.service.analysis.ReasoningBackend;

import java.io.IOException;

/**
 * Reasoning model behind HTTP. Posts the bundle JSON to {@code path} and expects
 * {@code {summary, outlook, confidence, details}} back.
 */
public final class HttpReasoningBackend implements ReasoningBackend {

    private final String name;
    private final HttpJsonClient client;
    private final String path;

    public HttpReasoningBackend(String name, HttpJsonClient client, String path) {
        this.name = name;
        this.client = client;
        this.path = path;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ReasoningOutput infer(ContextBundle bundle, Deadline deadline) throws Exception {
        JsonNode response = client.post(path, bundle.toJson(), deadline);
        return parse(response);
    }

    static ReasoningOutput parse(JsonNode response) throws IOException {
        if (response == null || !response.hasNonNull("summary")) {
            throw new IOException("Reasoning response has no summary");
        }
        Outlook outlook;
        try {
            outlook = Outlook.valueOf(response.path("outlook").asText("NEUTRAL").trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            outlook = Outlook.NEUTRAL;
        }
        double confidence = Math.max(0.0, Math.min(1.0, response.path("confidence").asDouble(0.5)));
        return new ReasoningOutput(response.get("summary").asText(), outlook, confidence, response.get("details"));
    }
}

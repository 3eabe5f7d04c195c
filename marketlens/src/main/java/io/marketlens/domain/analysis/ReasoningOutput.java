package io.marketlens.domain.analysis;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a reasoning backend returns before the router stamps request metadata on it.
 *
 * @param confidence 0.0 - 1.0
 * @param details    backend-specific structure, may be null
 */
public record ReasoningOutput(String summary, Outlook outlook, double confidence, JsonNode details) {

    public ReasoningOutput {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary is required");
        }
        if (outlook == null) {
            outlook = Outlook.NEUTRAL;
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }
}

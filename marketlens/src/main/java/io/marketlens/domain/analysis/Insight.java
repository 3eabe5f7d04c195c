package io.marketlens.domain.analysis;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Structured response to an analysis request.
 *
 * {@code partial} is set when the underlying bundle was incomplete;
 * {@code missingKinds} lists the kinds that did not contribute.
 */
public record Insight(
    String requestId,
    List<String> symbols,
    String summary,
    Outlook outlook,
    double confidence,
    boolean partial,
    Set<AnalysisKind> missingKinds,
    String backend,
    Instant generatedAt,
    JsonNode details
) {
    public Insight {
        symbols = List.copyOf(symbols);
        missingKinds = Set.copyOf(missingKinds);
    }
}

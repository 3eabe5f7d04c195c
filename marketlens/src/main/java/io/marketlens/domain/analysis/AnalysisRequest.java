package io.marketlens.domain.analysis;

import io.marketlens.domain.common.Deadline;
import io.marketlens.domain.data.Timeframe;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One client analysis request. Lives until its response or deadline.
 *
 * {@code kinds} must contain at least one analyzer kind; AI_INSIGHT alone is
 * expanded by the Gateway before the request is built.
 */
public record AnalysisRequest(
    String requestId,
    String principal,
    List<String> symbols,
    Set<AnalysisKind> kinds,
    Timeframe timeframe,
    Deadline deadline
) {
    public AnalysisRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        if (kinds == null || kinds.stream().noneMatch(AnalysisKind::isAnalyzer)) {
            throw new IllegalArgumentException("At least one analyzer kind is required");
        }
        if (timeframe == null || deadline == null) {
            throw new IllegalArgumentException("timeframe and deadline are required");
        }
        symbols = List.copyOf(symbols);
        kinds = Set.copyOf(kinds);
    }

    /**
     * Kinds that need an analyzer call, in declaration order.
     */
    public Set<AnalysisKind> analyzerKinds() {
        Set<AnalysisKind> result = EnumSet.noneOf(AnalysisKind.class);
        for (AnalysisKind k : kinds) {
            if (k.isAnalyzer()) result.add(k);
        }
        return result;
    }
}

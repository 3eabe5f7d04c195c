package io.marketlens.service.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.domain.common.Deadline;
import io.marketlens.infrastructure.fetch.UpstreamSource;

import java.util.Map;

/**
 * One analysis capability (technical, pattern, sentiment).
 *
 * Implementations must honour the deadline; they are called only through the
 * fetcher, which owns rate limiting and the circuit.
 */
public interface AnalyzerBackend {

    AnalysisKind kind();

    JsonNode analyze(String symbol, Map<String, String> params, Deadline deadline) throws Exception;

    /**
     * Adapter for {@code RateLimitedFetcher.registerSource}.
     */
    default UpstreamSource asUpstream() {
        return (params, deadline) -> analyze(params.symbol(), params.params(), deadline);
    }
}

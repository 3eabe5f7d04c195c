package io.marketlens.infrastructure.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.common.Deadline;

/**
 * External source reachable through {@link RateLimitedFetcher#fetch}.
 */
@FunctionalInterface
public interface UpstreamSource {

    JsonNode fetch(FetchParams params, Deadline deadline) throws Exception;
}

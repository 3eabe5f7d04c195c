package io.marketlens.infrastructure.fetch;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parameters of one upstream call. Extra params are kept sorted so derived cache keys are deterministic.
 */
public record FetchParams(String symbol, Map<String, String> params) {

    public FetchParams {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(params));
    }

    public static FetchParams of(String symbol, Map<String, String> params) {
        return new FetchParams(symbol, params);
    }

    public String param(String name) {
        return params.get(name);
    }
}

package io.marketlens.service.cache;

import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache keys: {@code source|SYMBOL|k1=v1&k2=v2} with params sorted by name.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String of(String source, String symbol, Map<String, String> params) {
        StringBuilder sb = new StringBuilder(source).append('|').append(symbol == null ? "" : symbol);
        if (params != null && !params.isEmpty()) {
            sb.append('|');
            boolean first = true;
            for (Map.Entry<String, String> e : new TreeMap<>(params).entrySet()) {
                if (!first) sb.append('&');
                sb.append(e.getKey()).append('=').append(e.getValue());
                first = false;
            }
        }
        return sb.toString();
    }
}

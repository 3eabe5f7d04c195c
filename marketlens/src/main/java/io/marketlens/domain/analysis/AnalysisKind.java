package io.marketlens.domain.analysis;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of analysis a client may request.
 *
 * TECHNICAL, PATTERN and SENTIMENT are served by analyzer backends. AI_INSIGHT
 * names the reasoning step itself and has no analyzer behind it.
 */
public enum AnalysisKind {
    TECHNICAL("technical", true),
    PATTERN("pattern", true),
    SENTIMENT("sentiment", true),
    AI_INSIGHT("ai-insight", false);

    private final String wireName;
    private final boolean analyzer;

    AnalysisKind(String wireName, boolean analyzer) {
        this.wireName = wireName;
        this.analyzer = analyzer;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isAnalyzer() {
        return analyzer;
    }

    public static Set<AnalysisKind> analyzerKinds() {
        return EnumSet.of(TECHNICAL, PATTERN, SENTIMENT);
    }

    /**
     * @throws IllegalArgumentException for unknown kinds
     */
    public static AnalysisKind fromWire(String name) {
        if (name != null) {
            String n = name.trim();
            for (AnalysisKind k : values()) {
                if (k.wireName.equalsIgnoreCase(n) || k.name().equalsIgnoreCase(n)) {
                    return k;
                }
            }
        }
        throw new IllegalArgumentException("Unknown analysis kind: " + name);
    }
}

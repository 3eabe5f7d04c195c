package io.marketlens.domain.analysis;

/**
 * One analyzer call within a bundle: a kind applied to a symbol.
 */
public record SlotKey(AnalysisKind kind, String symbol) {

    @Override
    public String toString() {
        return kind.wireName() + "/" + symbol;
    }
}

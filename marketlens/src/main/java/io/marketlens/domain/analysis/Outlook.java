package io.marketlens.domain.analysis;

public enum Outlook {
    BULLISH,
    BEARISH,
    NEUTRAL
}

package io.marketlens.infrastructure.fetch;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}

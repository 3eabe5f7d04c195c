package io.marketlens.domain.session;

/**
 * Connection lifecycle.
 *
 * <pre>
 * CONNECTING -> ACTIVE -> DRAINING -> CLOSED
 * CONNECTING -> CLOSED   (auth failure)
 * </pre>
 */
public enum ConnectionState {
    CONNECTING,
    ACTIVE,
    DRAINING,
    CLOSED;

    public boolean canTransitionTo(ConnectionState next) {
        return switch (this) {
            case CONNECTING -> next == ACTIVE || next == CLOSED;
            case ACTIVE -> next == DRAINING;
            case DRAINING -> next == CLOSED;
            case CLOSED -> false;
        };
    }

    /**
     * Whether market updates may still be queued for the connection.
     */
    public boolean acceptsDelivery() {
        return this == ACTIVE || this == DRAINING;
    }
}

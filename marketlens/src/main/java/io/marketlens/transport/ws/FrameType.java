package io.marketlens.transport.ws;

/**
 * Outbound frame types.
 */
public enum FrameType {
    ACK,
    BATCH,
    MARKET_UPDATE,
    INSIGHT,
    ERROR,
    PONG
}

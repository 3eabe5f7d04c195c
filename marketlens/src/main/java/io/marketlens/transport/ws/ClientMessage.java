package io.marketlens.transport.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Inbound frame. Which fields apply depends on {@code action}:
 * <pre>
 * subscribe / unsubscribe: topic, symbol, timeframe
 * analyze:                 requestId, symbols (or symbol), kinds, timeframe, deadlineMs
 * ping:                    nonce
 * close:                   (none)
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ClientMessage {
    public String action;
    public String topic;
    public String symbol;
    public String timeframe;
    public String requestId;
    public List<String> symbols;
    public List<String> kinds;
    public Long deadlineMs;
    public String nonce;
}

package io.marketlens.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outbound frame envelope: {@code {type, payload, ts, seq}}.
 */
public final class ServerMessage {
    public String type;
    public JsonNode payload;
    public String ts;
    public long seq;

    public ServerMessage() {
    }

    public ServerMessage(String type, JsonNode payload, String ts, long seq) {
        this.type = type;
        this.payload = payload;
        this.ts = ts;
        this.seq = seq;
    }
}

package io.marketlens.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketlens.domain.analysis.AnalysisKind;
import io.marketlens.domain.analysis.Insight;
import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.data.MarketUpdate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON encoding of client and server frames. {@code seq} is unique per process.
 */
public final class FrameCodec {

    private final ObjectMapper mapper;
    private final Clock clock;
    private final AtomicLong seq = new AtomicLong(0);

    public FrameCodec(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * @throws ProtocolException if the frame is not a JSON object with an action
     */
    public ClientMessage decode(String raw) {
        ClientMessage msg;
        try {
            msg = mapper.readValue(raw, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame: " + e.getOriginalMessage(), e);
        }
        if (msg == null || msg.action == null || msg.action.isBlank()) {
            throw new ProtocolException("Missing 'action'");
        }
        return msg;
    }

    public String ack(String action, ObjectNode payload) {
        payload.put("action", action);
        return encode(FrameType.ACK, payload);
    }

    public String batch(List<MarketUpdate> updates) {
        ObjectNode payload = mapper.createObjectNode();
        ArrayNode events = payload.putArray("events");
        for (MarketUpdate u : updates) {
            events.add(updateToJson(u));
        }
        return encode(FrameType.BATCH, payload);
    }

    public String insight(Insight insight) {
        ObjectNode p = mapper.createObjectNode();
        p.put("requestId", insight.requestId());
        ArrayNode symbols = p.putArray("symbols");
        insight.symbols().forEach(symbols::add);
        p.put("summary", insight.summary());
        p.put("outlook", insight.outlook().name());
        p.put("confidence", insight.confidence());
        p.put("partial", insight.partial());
        ArrayNode missing = p.putArray("missingKinds");
        for (AnalysisKind k : AnalysisKind.values()) {
            if (insight.missingKinds().contains(k)) missing.add(k.wireName());
        }
        p.put("backend", insight.backend());
        p.put("generatedAt", insight.generatedAt().toString());
        if (insight.details() != null) {
            p.set("details", insight.details());
        }
        return encode(FrameType.INSIGHT, p);
    }

    public String error(ErrorKind kind, String message, String requestId) {
        return error(kind, message, requestId, null);
    }

    /**
     * {@code retryAfterMs} is only written when {@code retryAfter} is known.
     */
    public String error(ErrorKind kind, String message, String requestId, Duration retryAfter) {
        ObjectNode p = mapper.createObjectNode();
        p.put("code", kind.code());
        p.put("message", message == null ? kind.clientMessage() : message);
        p.put("retryable", kind.isRetryable());
        if (retryAfter != null) {
            p.put("retryAfterMs", retryAfter.toMillis());
        }
        if (requestId != null) {
            p.put("requestId", requestId);
        }
        return encode(FrameType.ERROR, p);
    }

    public String pong(String nonce) {
        ObjectNode p = mapper.createObjectNode();
        p.put("nonce", nonce == null ? "" : nonce);
        p.put("pong", true);
        return encode(FrameType.PONG, p);
    }

    public ObjectNode updateToJson(MarketUpdate u) {
        ObjectNode obj = mapper.createObjectNode();
        obj.put("type", FrameType.MARKET_UPDATE.name());
        obj.put("topic", u.topic().wireName());
        obj.put("symbol", u.symbol());
        obj.put("timeframe", u.timeframe().code());
        obj.put("timestamp", u.timestamp());
        obj.set("data", u.payload().toJson());
        return obj;
    }

    public ObjectNode newPayload() {
        return mapper.createObjectNode();
    }

    private String encode(FrameType type, ObjectNode payload) {
        ServerMessage msg = new ServerMessage(type.name(), payload, Instant.now(clock).toString(), seq.incrementAndGet());
        try {
            return mapper.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            // tree nodes built here always serialize
            throw new IllegalStateException("Failed to serialize " + type + " frame", e);
        }
    }
}

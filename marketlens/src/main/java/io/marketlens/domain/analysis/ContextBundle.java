package io.marketlens.domain.analysis;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Merged analyzer outputs for one request.
 *
 * Complete only if every slot succeeded. Immutable once built.
 */
public final class ContextBundle {

    private final String requestId;
    private final Map<SlotKey, SlotOutcome> slots;

    public ContextBundle(String requestId, Map<SlotKey, SlotOutcome> slots) {
        this.requestId = requestId;
        this.slots = Collections.unmodifiableMap(new LinkedHashMap<>(slots));
    }

    public String requestId() {
        return requestId;
    }

    public Map<SlotKey, SlotOutcome> slots() {
        return slots;
    }

    public SlotOutcome outcome(AnalysisKind kind, String symbol) {
        return slots.get(new SlotKey(kind, symbol));
    }

    public boolean isComplete() {
        if (slots.isEmpty()) return false;
        for (SlotOutcome o : slots.values()) {
            if (!o.isSuccess()) return false;
        }
        return true;
    }

    public boolean hasAnySuccess() {
        for (SlotOutcome o : slots.values()) {
            if (o.isSuccess()) return true;
        }
        return false;
    }

    /**
     * Kinds with at least one errored slot.
     */
    public Set<AnalysisKind> missingKinds() {
        Set<AnalysisKind> missing = EnumSet.noneOf(AnalysisKind.class);
        for (Map.Entry<SlotKey, SlotOutcome> e : slots.entrySet()) {
            if (!e.getValue().isSuccess()) {
                missing.add(e.getKey().kind());
            }
        }
        return missing;
    }

    /**
     * JSON view handed to reasoning backends: {@code {requestId, complete, slots: {kind: {symbol: ...}}}}.
     * Errored slots carry only their error code.
     */
    public ObjectNode toJson() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();
        root.put("requestId", requestId);
        root.put("complete", isComplete());
        ObjectNode byKind = root.putObject("slots");
        for (Map.Entry<SlotKey, SlotOutcome> e : slots.entrySet()) {
            ObjectNode kindNode = byKind.has(e.getKey().kind().wireName())
                ? (ObjectNode) byKind.get(e.getKey().kind().wireName())
                : byKind.putObject(e.getKey().kind().wireName());
            SlotOutcome o = e.getValue();
            if (o.isSuccess()) {
                kindNode.set(e.getKey().symbol(), o.result());
            } else {
                kindNode.putObject(e.getKey().symbol()).put("error", o.error().code());
            }
        }
        return root;
    }
}

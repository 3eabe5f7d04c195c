package io.marketlens.domain.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.common.ErrorKind;

/**
 * Result-or-error for one bundle slot.
 */
public record SlotOutcome(JsonNode result, ErrorKind error, boolean fromCache) {

    public static SlotOutcome success(JsonNode result, boolean fromCache) {
        if (result == null) {
            throw new IllegalArgumentException("Successful outcome needs a result");
        }
        return new SlotOutcome(result, null, fromCache);
    }

    public static SlotOutcome failure(ErrorKind error) {
        return new SlotOutcome(null, error, false);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

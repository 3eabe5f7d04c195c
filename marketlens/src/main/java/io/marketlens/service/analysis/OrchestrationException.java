package io.marketlens.service.analysis;

import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.common.MarketLensException;

import java.time.Duration;

/**
 * Request-level failure of the orchestration router: NO_CONTEXT,
 * DEADLINE_EXCEEDED, REASONING_UNAVAILABLE or DISCONNECTED.
 */
public class OrchestrationException extends MarketLensException {

    private final String requestId;

    public OrchestrationException(String requestId, ErrorKind kind, String message) {
        super(kind, message);
        this.requestId = requestId;
    }

    public OrchestrationException(String requestId, ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
        this.requestId = requestId;
    }

    public OrchestrationException(String requestId, ErrorKind kind, String message, Throwable cause,
                                  Duration retryAfter) {
        super(kind, message, cause, retryAfter);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}

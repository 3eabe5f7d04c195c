package io.marketlens.domain.common;

/**
 * Error kinds surfaced to clients.
 *
 * Each kind has a stable wire code (the enum name) and a client-safe message.
 * Raw upstream error text is never sent to clients; it is logged instead.
 */
public enum ErrorKind {
    RATE_LIMITED("Upstream rate limit reached, retry shortly", true),
    CIRCUIT_OPEN("Upstream source temporarily unavailable", true),
    TIMEOUT("Operation timed out", true),
    NO_CONTEXT("No analysis data could be gathered for this request", true),
    DEADLINE_EXCEEDED("Request exceeded its deadline", true),
    AUTH_FAILED("Authentication failed", false),
    DISCONNECTED("Connection is closing", false),
    REASONING_UNAVAILABLE("Insight service unavailable", true),
    UPSTREAM_FAILURE("Upstream service error", true),
    INVALID_REQUEST("Invalid request", false),
    FEATURE_DISABLED("Feature is disabled", false),
    INTERNAL("Internal error", false);

    private final String clientMessage;
    private final boolean retryable;

    ErrorKind(String clientMessage, boolean retryable) {
        this.clientMessage = clientMessage;
        this.retryable = retryable;
    }

    public String code() {
        return name();
    }

    public String clientMessage() {
        return clientMessage;
    }

    /**
     * Whether the same request may succeed if sent again later. Transient
     * upstream conditions are retryable; bad input and auth are not.
     */
    public boolean isRetryable() {
        return retryable;
    }
}

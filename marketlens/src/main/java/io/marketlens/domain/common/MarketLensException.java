package io.marketlens.domain.common;

import java.time.Duration;
import java.util.Optional;

/**
 * Base exception carrying an {@link ErrorKind}.
 *
 * The exception message is for logs. Clients only ever see {@link #clientMessage()}.
 */
public class MarketLensException extends RuntimeException {

    private final ErrorKind kind;
    private final Duration retryAfter;

    public MarketLensException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public MarketLensException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, null);
    }

    /**
     * @param retryAfter how long the client should wait before retrying, or null if unknown
     */
    public MarketLensException(ErrorKind kind, String message, Throwable cause, Duration retryAfter) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public String clientMessage() {
        return kind.clientMessage();
    }
}

package io.marketlens.infrastructure.fetch;

import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.common.MarketLensException;

import java.time.Duration;

/**
 * Failure of a guarded upstream call.
 */
public class FetchException extends MarketLensException {

    private final String source;

    public FetchException(String source, ErrorKind kind, String message) {
        super(kind, String.format("[%s] %s", source, message));
        this.source = source;
    }

    /**
     * Admission rejection with a hint of when the source may admit again.
     */
    public FetchException(String source, ErrorKind kind, String message, Duration retryAfter) {
        super(kind, String.format("[%s] %s", source, message), null, retryAfter);
        this.source = source;
    }

    public FetchException(String source, ErrorKind kind, String message, Throwable cause) {
        super(kind, String.format("[%s] %s", source, message), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}

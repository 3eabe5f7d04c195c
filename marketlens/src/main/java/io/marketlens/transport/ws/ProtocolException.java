package io.marketlens.transport.ws;

import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.common.MarketLensException;

/**
 * Client frame that cannot be understood at all (bad JSON, missing or unknown action).
 * Ends the connection.
 */
public class ProtocolException extends MarketLensException {

    public ProtocolException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorKind.INVALID_REQUEST, message, cause);
    }
}

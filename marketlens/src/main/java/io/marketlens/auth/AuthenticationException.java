package io.marketlens.auth;

import io.marketlens.domain.common.ErrorKind;
import io.marketlens.domain.common.MarketLensException;

public class AuthenticationException extends MarketLensException {

    public AuthenticationException(String message) {
        super(ErrorKind.AUTH_FAILED, message);
    }
}

package com.salonhub.authservice.exceptions;

public class TokenReuseDetectedException extends AuthException {

    public TokenReuseDetectedException(String message) {
        super(AuthErrorCode.TOKEN_REUSE_DETECTED, message);
    }

    public TokenReuseDetectedException(String message, Throwable cause) {
        super(AuthErrorCode.TOKEN_REUSE_DETECTED, message, cause);
    }
}

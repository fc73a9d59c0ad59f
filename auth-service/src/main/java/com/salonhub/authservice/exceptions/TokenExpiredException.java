package com.salonhub.authservice.exceptions;

public class TokenExpiredException extends AuthException {

    public TokenExpiredException(String message) {
        super(AuthErrorCode.TOKEN_EXPIRED, message);
    }

    public TokenExpiredException(String message, Throwable cause) {
        super(AuthErrorCode.TOKEN_EXPIRED, message, cause);
    }
}

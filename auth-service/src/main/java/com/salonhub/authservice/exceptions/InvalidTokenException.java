package com.salonhub.authservice.exceptions;

public class InvalidTokenException extends AuthException {

    public InvalidTokenException(String message) {
        super(AuthErrorCode.INVALID_TOKEN, message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(AuthErrorCode.INVALID_TOKEN, message, cause);
    }
}

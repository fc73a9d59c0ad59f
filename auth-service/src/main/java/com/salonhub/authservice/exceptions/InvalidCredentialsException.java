package com.salonhub.authservice.exceptions;

public class InvalidCredentialsException extends AuthException {

    public InvalidCredentialsException(String message) {
        super(AuthErrorCode.INVALID_CREDENTIALS, message);
    }

    public InvalidCredentialsException(String message, Throwable cause) {
        super(AuthErrorCode.INVALID_CREDENTIALS, message, cause);
    }
}

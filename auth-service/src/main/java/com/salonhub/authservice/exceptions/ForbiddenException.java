package com.salonhub.authservice.exceptions;

public class ForbiddenException extends AuthException {

    public ForbiddenException(String message) {
        super(AuthErrorCode.FORBIDDEN, message);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(AuthErrorCode.FORBIDDEN, message, cause);
    }
}

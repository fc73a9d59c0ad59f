package com.salonhub.authservice.exceptions;

/**
 * Base type for every authentication and authorization failure. The exception message is for server
 * logs; clients only ever see {@link AuthErrorCode#clientMessage()}.
 */
public abstract class AuthException extends RuntimeException {

    private final AuthErrorCode errorCode;

    protected AuthException(AuthErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AuthException(AuthErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }
}

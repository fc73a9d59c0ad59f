package com.salonhub.authservice.exceptions;

/**
 * The tenant session variable could not be applied. Treated as an authentication failure, never as
 * "activation succeeded".
 */
public class TenantContextActivationException extends AuthException {

    public TenantContextActivationException(String message, Throwable cause) {
        super(AuthErrorCode.TENANT_CONTEXT_UNAVAILABLE, message, cause);
    }
}

package com.salonhub.authservice.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Client-facing error kinds. Messages are deliberately generic: which check failed is only ever logged.
 */
public enum AuthErrorCode {
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "invalid-credentials", "Invalid credentials"),
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "account-locked", "Account is locked. Try again later"),
    // expired and invalid tokens are indistinguishable to clients
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "invalid-token", "Invalid or expired token"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "invalid-token", "Invalid or expired token"),
    TOKEN_REUSE_DETECTED(HttpStatus.UNAUTHORIZED, "session-revoked", "Session is no longer valid. Please login again"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "forbidden", "Insufficient permissions"),
    TENANT_CONTEXT_UNAVAILABLE(HttpStatus.UNAUTHORIZED, "authentication-failed", "Authentication failed"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "rate-limited", "Too many requests. Please try again later");

    private final HttpStatus status;
    private final String problemType;
    private final String clientMessage;

    AuthErrorCode(HttpStatus status, String problemType, String clientMessage) {
        this.status = status;
        this.problemType = problemType;
        this.clientMessage = clientMessage;
    }

    public String problemType() {
        return problemType;
    }

    public HttpStatus status() {
        return status;
    }

    public String clientMessage() {
        return clientMessage;
    }
}

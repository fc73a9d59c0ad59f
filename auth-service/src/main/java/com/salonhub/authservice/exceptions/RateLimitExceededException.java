package com.salonhub.authservice.exceptions;

public class RateLimitExceededException extends AuthException {

    private final long retryAfterSeconds;
    private final String clientMessage;

    public RateLimitExceededException(String clientMessage, long retryAfterSeconds) {
        super(AuthErrorCode.RATE_LIMITED, clientMessage);
        this.clientMessage = clientMessage;
        this.retryAfterSeconds = Math.max(retryAfterSeconds, 0);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public String getClientMessage() {
        return clientMessage;
    }
}

package com.salonhub.authservice.exceptions;

import java.time.Duration;

public class AccountLockedException extends AuthException {

    private final Duration retryAfter;

    public AccountLockedException(String message, Duration retryAfter) {
        super(AuthErrorCode.ACCOUNT_LOCKED, message);
        this.retryAfter = retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    /**
     * Time until the lock lapses, rounded up to whole seconds.
     */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}

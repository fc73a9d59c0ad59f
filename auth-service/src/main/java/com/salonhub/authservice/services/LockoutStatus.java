package com.salonhub.authservice.services;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Lock state right after a failed attempt was counted. {@code lockedUntil} is null unless locked.
 */
@Value
public class LockoutStatus {
    boolean locked;
    LocalDateTime lockedUntil;
    int failedLoginCount;
}

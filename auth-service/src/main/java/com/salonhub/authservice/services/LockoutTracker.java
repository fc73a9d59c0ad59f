package com.salonhub.authservice.services;

import com.salonhub.authservice.configurations.AuthProperties;
import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Failed-login counter and timed lock per user, kept on the user row.
 * <p>
 * The counter is only ever changed by a single UPDATE statement, so concurrent failures cannot
 * under-count. A lock whose time has passed is treated as unlocked without being cleared.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LockoutTracker {

    private final UserAccountRepository userAccountRepository;
    private final AuthProperties authProperties;
    private final Clock clock;

    /**
     * Count one failed attempt, locking the account when the threshold is reached.
     *
     * @return the state after the increment, or empty if the user no longer exists
     */
    @Transactional
    public Optional<LockoutStatus> recordFailure(UUID userId) {
        AuthProperties.Lockout lockout = authProperties.getLockout();
        LocalDateTime now = LocalDateTime.now(clock);

        int updated = userAccountRepository.incrementFailedLoginCount(
                userId, now, lockout.getMaxFailedAttempts(), now.plus(lockout.getLockDuration()));
        if (updated == 0) {
            log.warn("Failed attempt not recorded, user {} no longer exists", userId);
            return Optional.empty();
        }

        // same transaction, so this reads the row our update still holds locked
        return userAccountRepository.findLockStateById(userId).map(state -> {
            boolean locked = isLockedAt(state.getLockedUntil(), now);
            log.debug("Failed attempt {} for user {}", state.getFailedLoginCount(), userId);
            return new LockoutStatus(locked, locked ? state.getLockedUntil() : null, state.getFailedLoginCount());
        });
    }

    /**
     * Clear the counter and any lock. Called after every successful login.
     */
    @Transactional
    public void reset(UUID userId) {
        userAccountRepository.resetFailedLoginCount(userId);
        log.debug("Reset failed attempts for user: {}", userId);
    }

    /**
     * Clear the counter and any lock, and stamp the login time, in one transaction.
     *
     * @return false if the user no longer exists
     */
    @Transactional
    public boolean recordSuccess(UUID userId, LocalDateTime loginTime) {
        userAccountRepository.resetFailedLoginCount(userId);
        int updated = userAccountRepository.updateLastLogin(userId, loginTime);
        log.debug("Login recorded for user {} at {}", userId, loginTime);
        return updated > 0;
    }

    @Transactional(readOnly = true)
    public boolean isLocked(UUID userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return userAccountRepository.findLockStateById(userId)
                .map(state -> isLockedAt(state.getLockedUntil(), now))
                .orElse(false);
    }

    /**
     * Lock check against a row the caller has already loaded.
     */
    public boolean isLocked(UserAccount user) {
        return isLockedAt(user.getLockedUntil(), LocalDateTime.now(clock));
    }

    /**
     * Time left on a lock, zero when it has lapsed.
     */
    public Duration remainingLock(UserAccount user) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!isLockedAt(user.getLockedUntil(), now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, user.getLockedUntil());
    }

    private static boolean isLockedAt(LocalDateTime lockedUntil, LocalDateTime now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }
}

package com.salonhub.authservice.services.userlogin;

import com.salonhub.authservice.configurations.AuthProperties;
import com.salonhub.authservice.exceptions.AccountLockedException;
import com.salonhub.authservice.exceptions.InvalidCredentialsException;
import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.models.SecurityEvent;
import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.repository.UserAccountRepository;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import com.salonhub.authservice.services.ClientContext;
import com.salonhub.authservice.services.JwtService;
import com.salonhub.authservice.services.LockoutStatus;
import com.salonhub.authservice.services.LockoutTracker;
import com.salonhub.authservice.services.SecurityEventService;
import com.salonhub.authservice.services.VerifiedAccessToken;
import com.salonhub.authservice.tenancy.TenantContext;
import com.salonhub.authservice.tenancy.TenantContextManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for both ways of proving identity: email and password, or a signed access token.
 * <p>
 * Every credential branch performs exactly one password hash comparison, so response time does not
 * reveal whether an email exists or an account is locked. The token branch activates the tenant
 * context before it touches the database.
 */
@Service
@Slf4j
public class AuthenticationGate {

    private final UserAccountRepository userAccountRepository;
    private final LockoutTracker lockoutTracker;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final TenantContextManager tenantContextManager;
    private final SecurityEventService securityEventService;
    private final AuthProperties authProperties;
    private final Clock clock;

    // compared against when there is no real hash to check, to keep timing uniform
    private final String dummyPasswordHash;

    public AuthenticationGate(UserAccountRepository userAccountRepository,
                              LockoutTracker lockoutTracker,
                              PasswordEncoder passwordEncoder,
                              JwtService jwtService,
                              TenantContextManager tenantContextManager,
                              SecurityEventService securityEventService,
                              AuthProperties authProperties,
                              Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.lockoutTracker = lockoutTracker;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.tenantContextManager = tenantContextManager;
        this.securityEventService = securityEventService;
        this.authProperties = authProperties;
        this.clock = clock;
        this.dummyPasswordHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Check email and password.
     *
     * @param tenantHint tenant to search in; required to disambiguate an email registered in several tenants
     * @return the authenticated user, ready for token issuance
     * @throws InvalidCredentialsException unknown email, wrong password, or a user that may not log in
     * @throws AccountLockedException      lock window active; the failure count is left unchanged
     */
    public UserAccount validateCredentials(String email, String password, String tenantHint, ClientContext client) {
        String rawPassword = password == null ? "" : password;
        Optional<UserAccount> candidate = findLoginCandidate(email, tenantHint);

        if (candidate.isEmpty()) {
            passwordEncoder.matches(rawPassword, dummyPasswordHash);
            log.info("Login failed: unknown email (tenant hint: {})", tenantHint);
            securityEventService.record(SecurityEvent.Type.LOGIN_FAILED, null, "Unknown email", client);
            throw new InvalidCredentialsException("Unknown email");
        }

        UserAccount user = candidate.get();

        if (lockoutTracker.isLocked(user)) {
            passwordEncoder.matches(rawPassword, dummyPasswordHash);
            log.warn("Login failed: account {} is locked until {}", user.getId(), user.getLockedUntil());
            securityEventService.record(SecurityEvent.Type.LOGIN_FAILED, user.getId(), "Account locked", client);
            throw new AccountLockedException("Account " + user.getId() + " is locked", lockoutTracker.remainingLock(user));
        }

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            recordFailedAttempt(user, client);
            throw new InvalidCredentialsException("Password mismatch for user " + user.getId());
        }

        if (user.getStatus() != UserAccount.Status.ACTIVE) {
            log.info("Login failed: account {} has status {}", user.getId(), user.getStatus());
            securityEventService.record(SecurityEvent.Type.LOGIN_FAILED, user.getId(),
                    "Account status " + user.getStatus(), client);
            throw new InvalidCredentialsException("Account " + user.getId() + " is " + user.getStatus());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (!lockoutTracker.recordSuccess(user.getId(), now)) {
            log.info("Login failed: user {} vanished before the login was recorded", user.getId());
            throw new InvalidCredentialsException("User " + user.getId() + " no longer exists");
        }
        user.setFailedLoginCount(0);
        user.setLockedUntil(null);
        user.setLastLogin(now);

        securityEventService.record(SecurityEvent.Type.LOGIN_SUCCESS, user.getId(), "User logged in", client);
        log.info("User {} authenticated", user.getId());
        return user;
    }

    /**
     * Verify an access token and activate its tenant for the rest of the request. The caller owns the
     * unit of work and must clear the tenant context when it ends.
     *
     * @throws com.salonhub.authservice.exceptions.TokenExpiredException token past expiry
     * @throws InvalidTokenException                                      any other defect, or a user
     *                                                                    who can no longer authenticate
     */
    public AuthenticatedPrincipal validateAccessToken(String accessToken) {
        VerifiedAccessToken verified = jwtService.verifyAccessToken(accessToken);

        // before any data access
        tenantContextManager.activate(TenantContext.fromVerifiedToken(verified));

        if (authProperties.getAccessToken().isVerifyUserState()) {
            boolean active;
            try {
                active = userAccountRepository.existsByIdAndDeletedFalseAndStatus(
                        verified.getUserId(), UserAccount.Status.ACTIVE);
            } catch (RuntimeException e) {
                tenantContextManager.clear();
                throw e;
            }
            if (!active) {
                tenantContextManager.clear();
                log.warn("Access token of user {} rejected: user deleted or not active", verified.getUserId());
                throw new InvalidTokenException("Token subject " + verified.getUserId() + " cannot authenticate");
            }
        }

        return verified.toPrincipal();
    }

    private void recordFailedAttempt(UserAccount user, ClientContext client) {
        Optional<LockoutStatus> status = lockoutTracker.recordFailure(user.getId());
        if (status.isEmpty()) {
            log.info("Login failed: user {} vanished while recording the failure", user.getId());
            return;
        }

        log.info("Login failed: password mismatch for user {} (attempt {})", user.getId(),
                status.get().getFailedLoginCount());
        securityEventService.record(SecurityEvent.Type.LOGIN_FAILED, user.getId(), "Password mismatch", client);

        if (status.get().isLocked()) {
            securityEventService.record(SecurityEvent.Type.ACCOUNT_LOCKED, user.getId(),
                    "Locked until " + status.get().getLockedUntil() + " after "
                            + status.get().getFailedLoginCount() + " failed attempts", client);
        }
    }

    private Optional<UserAccount> findLoginCandidate(String email, String tenantHint) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        if (tenantHint != null && !tenantHint.isBlank()) {
            return userAccountRepository.findNotDeletedByEmailAndTenantId(email.trim(), tenantHint.trim());
        }

        List<UserAccount> matches = userAccountRepository.findAllNotDeletedByEmail(email.trim());
        if (matches.size() > 1) {
            log.info("Email matches accounts in {} tenants and no tenant hint was given", matches.size());
            return Optional.empty();
        }
        return matches.stream().findFirst();
    }
}

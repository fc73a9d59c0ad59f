package com.salonhub.authservice.services.userlogin;

import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.exceptions.TokenExpiredException;
import com.salonhub.authservice.exceptions.TokenReuseDetectedException;
import com.salonhub.authservice.models.RefreshToken;
import com.salonhub.authservice.models.RevocationReason;
import com.salonhub.authservice.models.SecurityEvent;
import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.repository.RefreshTokenRepository;
import com.salonhub.authservice.repository.UserAccountRepository;
import com.salonhub.authservice.services.ClientContext;
import com.salonhub.authservice.services.SecurityEventService;
import com.salonhub.authservice.services.TokenHasher;
import com.salonhub.authservice.services.TokenIssuer;
import com.salonhub.authservice.services.TokenPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Exchanges a refresh token for a new pair.
 * <p>
 * Each row goes Active to Rotated exactly once. Presenting a row that is already revoked is treated
 * as a leaked token: every refresh token of its owner is revoked and the call fails. That revoke-all
 * commits even though the method throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenRotationEngine {

    private static final Logger SECURITY_AUDIT = LoggerFactory.getLogger("SECURITY_AUDIT");

    private final RefreshTokenRepository refreshTokenRepository;
    private final UserAccountRepository userAccountRepository;
    private final TokenIssuer tokenIssuer;
    private final TokenHasher tokenHasher;
    private final SecurityEventService securityEventService;
    private final Clock clock;

    /**
     * Rotate a refresh token.
     *
     * @throws InvalidTokenException       unknown token, or its owner can no longer authenticate
     * @throws TokenExpiredException       token past its expiry; it is left as is
     * @throws TokenReuseDetectedException token already revoked; all of the owner's tokens are now revoked
     */
    @Transactional(noRollbackFor = TokenReuseDetectedException.class)
    public TokenPair rotate(String presentedRefreshToken, ClientContext client) {
        if (presentedRefreshToken == null || presentedRefreshToken.isBlank()) {
            throw new InvalidTokenException("Refresh token missing");
        }

        // Lock the row: concurrent rotations of the same token queue up here
        RefreshToken token = refreshTokenRepository
                .findByTokenHashForUpdate(tokenHasher.digest(presentedRefreshToken))
                .orElseThrow(() -> {
                    log.warn("Refresh attempted with unknown token");
                    return new InvalidTokenException("Unknown refresh token");
                });

        LocalDateTime now = LocalDateTime.now(clock);
        UUID userId = token.getUser().getId();

        if (token.isExpiredAt(now)) {
            log.info("Refresh attempted with expired token {} of user {}", token.getId(), userId);
            throw new TokenExpiredException("Refresh token expired");
        }

        if (token.isRevoked()) {
            throw reuseDetected(token.getId(), userId, token.getRevokedReason(), client, now);
        }

        UserAccount user = userAccountRepository.findByIdAndDeletedFalse(userId)
                .filter(UserAccount::canAuthenticate)
                .orElseThrow(() -> {
                    log.warn("Refresh rejected, user {} is deleted or not active", userId);
                    return new InvalidTokenException("Token owner cannot authenticate");
                });

        String deviceInfo = token.getDeviceInfo();
        String ipAddress = token.getIpAddress();

        // Conditional on revoked = false: losing a race here is the same as presenting a revoked token
        if (refreshTokenRepository.revokeIfActive(token.getId(), RevocationReason.ROTATED, now) == 0) {
            throw reuseDetected(token.getId(), userId, RevocationReason.ROTATED, client, now);
        }

        TokenPair pair = tokenIssuer.issue(user, new ClientContext(ipAddress, deviceInfo));

        securityEventService.record(SecurityEvent.Type.TOKEN_ROTATED, userId,
                "Refresh token rotated", client);
        log.info("Rotated refresh token {} for user {}", token.getId(), userId);
        return pair;
    }

    private TokenReuseDetectedException reuseDetected(UUID tokenId, UUID userId, RevocationReason previousReason,
                                                      ClientContext client, LocalDateTime now) {
        int revoked = refreshTokenRepository.revokeAllActiveByUserId(userId, RevocationReason.REUSE_DETECTED, now);

        SECURITY_AUDIT.error("Refresh token reuse detected: token={} user={} previouslyRevokedAs={} ip={}; revoked {} active tokens",
                tokenId, userId, previousReason == null ? null : previousReason.value(),
                client == null ? null : client.getIpAddress(), revoked);
        securityEventService.record(SecurityEvent.Type.TOKEN_REUSE_DETECTED, userId,
                "Revoked token presented; " + revoked + " active tokens revoked", client);

        return new TokenReuseDetectedException("Revoked refresh token presented for user " + userId);
    }
}

package com.salonhub.authservice.services.userlogin;

import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.models.RevocationReason;
import com.salonhub.authservice.models.SecurityEvent;
import com.salonhub.authservice.repository.RefreshTokenRepository;
import com.salonhub.authservice.services.ClientContext;
import com.salonhub.authservice.services.SecurityEventService;
import com.salonhub.authservice.services.TokenHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class Logout {

    private final RefreshTokenRepository refreshTokenRepository;
    private final TokenHasher tokenHasher;
    private final SecurityEventService securityEventService;
    private final Clock clock;

    /**
     * End one session by revoking its refresh token. The token must belong to the caller and still be
     * active.
     */
    @Transactional
    public void logout(UUID userId, String refreshToken, ClientContext client) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new InvalidTokenException("Refresh token missing on logout");
        }

        int revoked = refreshTokenRepository.revokeIfActiveAndOwnedBy(
                tokenHasher.digest(refreshToken), userId, RevocationReason.LOGOUT, LocalDateTime.now(clock));
        if (revoked == 0) {
            log.warn("Logout for user {} presented a token that is unknown, foreign or already revoked", userId);
            throw new InvalidTokenException("Refresh token not revocable by user " + userId);
        }

        securityEventService.record(SecurityEvent.Type.LOGOUT, userId, "User logged out", client);
        log.info("User {} logged out", userId);
    }

    /**
     * Revoke every active refresh token of the user, ending all of their sessions.
     *
     * @return number of tokens revoked
     */
    @Transactional
    public int revokeAllSessions(UUID userId, ClientContext client) {
        int revoked = refreshTokenRepository.revokeAllActiveByUserId(
                userId, RevocationReason.REVOKE_ALL, LocalDateTime.now(clock));

        securityEventService.record(SecurityEvent.Type.REVOKE_ALL, userId,
                "All sessions terminated; " + revoked + " tokens revoked", client);
        log.info("All sessions terminated for user ID: {} ({} tokens)", userId, revoked);
        return revoked;
    }
}

package com.salonhub.authservice.services;

import com.salonhub.authservice.configurations.AuthProperties;
import com.salonhub.authservice.models.RefreshToken;
import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.repository.RefreshTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mints access/refresh pairs. Each call persists exactly one new, active refresh-token row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenIssuer {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final JwtService jwtService;
    private final TokenHasher tokenHasher;
    private final RefreshTokenRepository refreshTokenRepository;
    private final AuthProperties authProperties;
    private final Clock clock;

    /**
     * Issue a pair for the user. Joins the caller's transaction when there is one, so a rotation
     * revokes the old row and stores the new one atomically.
     */
    @Transactional
    public TokenPair issue(UserAccount user, ClientContext client) {
        ClientContext origin = client == null ? ClientContext.unknown() : client;
        LocalDateTime now = LocalDateTime.now(clock);

        JwtService.SignedAccessToken accessToken = jwtService.generateAccessToken(user, resolvePermissions(user));

        String refreshTokenValue = generateRefreshTokenValue();
        LocalDateTime refreshExpiresAt = now.plus(authProperties.getRefreshToken().getTtl());

        RefreshToken refreshToken = RefreshToken.builder()
                .tokenHash(tokenHasher.digest(refreshTokenValue))
                .user(user)
                .expiresAt(refreshExpiresAt)
                .deviceInfo(origin.getUserAgent())
                .ipAddress(origin.getIpAddress())
                .createdAt(now)
                .build();
        refreshTokenRepository.save(refreshToken);

        log.info("Issued token pair for user {}", user.getId());
        return new TokenPair(accessToken.getValue(), refreshTokenValue,
                authProperties.getJwt().getAccessTokenTtl().getSeconds(), refreshExpiresAt);
    }

    /**
     * Role permissions plus the user's additional grants. This is the snapshot embedded in the access
     * token.
     */
    public Set<String> resolvePermissions(UserAccount user) {
        Set<String> permissions = new TreeSet<>();
        if (user.getRole() != null && user.getRole().getPermissions() != null) {
            permissions.addAll(user.getRole().getPermissions());
        }
        if (user.getAdditionalPermissions() != null) {
            permissions.addAll(user.getAdditionalPermissions());
        }
        return permissions;
    }

    private String generateRefreshTokenValue() {
        byte[] bytes = new byte[authProperties.getRefreshToken().getLengthBytes()];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}

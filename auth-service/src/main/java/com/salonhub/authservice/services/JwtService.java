package com.salonhub.authservice.services;

import com.salonhub.authservice.configurations.AuthProperties;
import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.exceptions.TokenExpiredException;
import com.salonhub.authservice.models.UserAccount;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtEncodingException;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JwtService {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_TENANT_ID = "tenantId";
    static final String CLAIM_SUPER_ADMIN = "superAdmin";
    static final String CLAIM_ROLE_ID = "roleId";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_TOKEN_TYPE = "tokenType";
    static final String ACCESS_TOKEN_TYPE = "ACCESS";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final AuthProperties authProperties;
    private final Clock clock;

    /**
     * Sign an access token carrying the user's identity, tenant, role and a snapshot of the given
     * permissions. The snapshot is not refreshed until the next issuance.
     */
    public SignedAccessToken generateAccessToken(UserAccount user, Collection<String> permissions) {
        Instant now = clock.instant();
        Instant expiry = now.plus(authProperties.getJwt().getAccessTokenTtl());

        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
                .issuer(authProperties.getJwt().getIssuer())
                .issuedAt(now)
                .expiresAt(expiry)
                .subject(user.getId().toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_SUPER_ADMIN, user.isSuperAdmin())
                .claim(CLAIM_ROLE_ID, user.getRole().getId().toString())
                .claim(CLAIM_PERMISSIONS, List.copyOf(permissions))
                .claim(CLAIM_TOKEN_TYPE, ACCESS_TOKEN_TYPE);

        // absent rather than null for super-admins
        if (user.getTenantId() != null) {
            claims.claim(CLAIM_TENANT_ID, user.getTenantId());
        }

        try {
            String token = jwtEncoder.encode(JwtEncoderParameters.from(claims.build())).getTokenValue();
            log.debug("Generated access token for user: {}", user.getId());
            return new SignedAccessToken(token, expiry);
        } catch (JwtEncodingException e) {
            log.error("Error generating access token for user: {}", user.getId(), e);
            throw new IllegalStateException("Failed to generate access token", e);
        }
    }

    /**
     * Verify signature, issuer and expiry of an access token and read its claims.
     *
     * @throws TokenExpiredException when the token is past its expiry
     * @throws InvalidTokenException for any other defect, including missing or inconsistent claims
     */
    public VerifiedAccessToken verifyAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Access token missing");
        }

        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtValidationException e) {
            if (isExpiry(e)) {
                log.debug("Access token expired: {}", e.getMessage());
                throw new TokenExpiredException("Access token expired", e);
            }
            log.warn("Access token failed validation: {}", e.getMessage());
            throw new InvalidTokenException("Access token failed validation", e);
        } catch (JwtException e) {
            log.warn("Malformed or unsigned access token: {}", e.getMessage());
            throw new InvalidTokenException("Malformed access token", e);
        }

        return readClaims(jwt);
    }

    private VerifiedAccessToken readClaims(Jwt jwt) {
        if (!ACCESS_TOKEN_TYPE.equals(jwt.getClaimAsString(CLAIM_TOKEN_TYPE))) {
            throw new InvalidTokenException("Token is not an access token");
        }

        UUID userId = parseUuid(jwt.getSubject(), "sub");
        UUID roleId = parseUuid(jwt.getClaimAsString(CLAIM_ROLE_ID), CLAIM_ROLE_ID);
        String tenantId = jwt.getClaimAsString(CLAIM_TENANT_ID);
        boolean superAdmin = Boolean.TRUE.equals(jwt.getClaimAsBoolean(CLAIM_SUPER_ADMIN));

        // a missing tenant claim only means super-admin when the token says so explicitly
        if (superAdmin == (tenantId != null)) {
            throw new InvalidTokenException("Tenant claim inconsistent with super-admin flag for user " + userId);
        }

        List<String> permissions = jwt.getClaimAsStringList(CLAIM_PERMISSIONS);
        return new VerifiedAccessToken(userId, jwt.getClaimAsString(CLAIM_EMAIL), tenantId, roleId,
                permissions == null ? List.of() : permissions, jwt.getExpiresAt());
    }

    private UUID parseUuid(String value, String claim) {
        if (value == null) {
            throw new InvalidTokenException("Access token missing claim " + claim);
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Access token claim " + claim + " is not a UUID", e);
        }
    }

    private boolean isExpiry(JwtValidationException e) {
        return e.getErrors().stream()
                .map(OAuth2Error::getDescription)
                .anyMatch(description -> description != null && description.startsWith("Jwt expired"));
    }

    @Value
    public static class SignedAccessToken {
        String value;
        Instant expiresAt;
    }
}

package com.salonhub.authservice.services;

import com.salonhub.authservice.security.AuthenticatedPrincipal;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Claims of an access token whose signature, issuer and expiry have been checked. Only
 * {@link JwtService} can create one, which makes it the proof required to build a tenant context
 * from a token.
 */
@Getter
@ToString
public final class VerifiedAccessToken {

    private final UUID userId;
    private final String email;
    private final String tenantId;
    private final UUID roleId;
    private final List<String> permissions;
    private final Instant expiresAt;

    VerifiedAccessToken(UUID userId, String email, String tenantId, UUID roleId,
                        List<String> permissions, Instant expiresAt) {
        this.userId = userId;
        this.email = email;
        this.tenantId = tenantId;
        this.roleId = roleId;
        this.permissions = List.copyOf(permissions);
        this.expiresAt = expiresAt;
    }

    public boolean isSuperAdmin() {
        return tenantId == null;
    }

    public AuthenticatedPrincipal toPrincipal() {
        return new AuthenticatedPrincipal(userId, email, tenantId, roleId, permissions);
    }
}

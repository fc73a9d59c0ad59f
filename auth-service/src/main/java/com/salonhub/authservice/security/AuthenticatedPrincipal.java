package com.salonhub.authservice.security;

import com.salonhub.authservice.permissions.PermissionSet;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * The caller behind a verified access token. Permissions are the snapshot embedded at issuance and
 * are not re-read per request.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AuthenticatedPrincipal {

    private final UUID userId;
    private final String email;
    private final String tenantId;
    private final UUID roleId;
    private final Set<String> permissions;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final PermissionSet permissionSet;

    public AuthenticatedPrincipal(UUID userId, String email, String tenantId, UUID roleId,
                                  Collection<String> permissions) {
        this.userId = userId;
        this.email = email;
        this.tenantId = tenantId;
        this.roleId = roleId;
        this.permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        this.permissionSet = PermissionSet.parse(this.permissions);
    }

    public boolean isSuperAdmin() {
        return tenantId == null;
    }
}

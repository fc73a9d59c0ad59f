package com.salonhub.authservice.permissions;

import com.salonhub.authservice.exceptions.ForbiddenException;
import com.salonhub.authservice.models.Role;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a principal's permissions into collection filters and entity checks.
 * <p>
 * A super-admin (no tenant) is never narrowed, whatever permissions it holds. For everyone else
 * {@code resource:action:all} reaches every tenant, {@code resource:action:own} only the principal's
 * own tenant, and anything else is denied. Database row filtering applies on top of this independently.
 */
@Slf4j
@Component
public class PermissionScopeResolver {

    public static final String DEFAULT_ACTION = "read";

    public <T extends TenantOwned> Specification<T> scopeQuery(AuthenticatedPrincipal principal,
                                                              Specification<T> baseFilter,
                                                              String resource) {
        return scopeQuery(principal, baseFilter, resource, DEFAULT_ACTION);
    }

    /**
     * Narrow a collection query to what the principal may see.
     *
     * @return {@code baseFilter} itself when no narrowing applies, otherwise {@code baseFilter} AND
     *         {@code tenantId = principal.tenantId}
     * @throws ForbiddenException when the principal holds neither scope for {@code resource:action}
     */
    public <T extends TenantOwned> Specification<T> scopeQuery(AuthenticatedPrincipal principal,
                                                              Specification<T> baseFilter,
                                                              String resource,
                                                              String action) {
        requirePrincipal(principal);

        if (principal.isSuperAdmin()) {
            return baseFilter;
        }

        PermissionSet permissions = principal.getPermissionSet();
        if (permissions.grants(resource, action, PermissionScope.ALL)) {
            return baseFilter;
        }

        if (permissions.grants(resource, action, PermissionScope.OWN)) {
            Specification<T> ownTenant = tenantEquals(principal.getTenantId());
            return baseFilter == null ? ownTenant : baseFilter.and(ownTenant);
        }

        log.info("User {} denied {}:{} on collection", principal.getUserId(), resource, action);
        throw new ForbiddenException("No scope for " + resource + ":" + action);
    }

    /**
     * Post-fetch check of a single entity against one permission string. Fails closed: unknown or
     * unscoped permissions, permissions the principal does not hold, and null entities all deny.
     */
    public boolean canAccessEntity(AuthenticatedPrincipal principal, TenantOwned entity, String permission) {
        if (principal == null) {
            return false;
        }
        if (principal.isSuperAdmin()) {
            return true;
        }
        if (entity == null) {
            return false;
        }

        Optional<Permission> parsed = Permission.parse(permission);
        if (parsed.isEmpty() || !principal.getPermissionSet().contains(parsed.get())) {
            return false;
        }

        PermissionScope scope = parsed.get().scope();
        if (scope == PermissionScope.ALL) {
            return true;
        }
        if (scope == PermissionScope.OWN) {
            return entity.getTenantId() != null && entity.getTenantId().equals(principal.getTenantId());
        }
        return false;
    }

    /**
     * Require access to the entity through either {@code resource:action:all} or {@code resource:action:own}.
     *
     * @return the entity, for chaining
     */
    public <T extends TenantOwned> T requireEntityAccess(AuthenticatedPrincipal principal, T entity,
                                                         String resource, String action) {
        if (canAccessEntity(principal, entity, Permission.of(resource, action, PermissionScope.ALL).toString())
                || canAccessEntity(principal, entity, Permission.of(resource, action, PermissionScope.OWN).toString())) {
            return entity;
        }
        log.info("User {} denied {}:{} on entity", principal == null ? null : principal.getUserId(), resource, action);
        throw new ForbiddenException("No access to " + resource + ":" + action + " entity");
    }

    /**
     * Require that the principal may act on data of {@code targetTenantId}.
     */
    public void validateTenantAccess(AuthenticatedPrincipal principal, String targetTenantId,
                                     String resource, String action) {
        requirePrincipal(principal);

        if (principal.isSuperAdmin()) {
            return;
        }

        PermissionSet permissions = principal.getPermissionSet();
        if (permissions.grants(resource, action, PermissionScope.ALL)) {
            return;
        }
        if (targetTenantId != null
                && permissions.grants(resource, action, PermissionScope.OWN)
                && Objects.equals(targetTenantId, principal.getTenantId())) {
            return;
        }

        log.info("User {} of tenant {} denied {}:{} on tenant {}", principal.getUserId(),
                principal.getTenantId(), resource, action, targetTenantId);
        throw new ForbiddenException("Cross-tenant access denied for " + resource + ":" + action);
    }

    /**
     * Roles visible to the principal: all of them for a super-admin, otherwise system roles and the
     * principal's own tenant roles.
     */
    public Specification<Role> roleScope(AuthenticatedPrincipal principal) {
        requirePrincipal(principal);

        if (principal.isSuperAdmin()) {
            return Specification.where(null);
        }
        String tenantId = principal.getTenantId();
        return (root, query, cb) -> cb.or(
                cb.isTrue(root.get("system")),
                cb.equal(root.get(TenantOwned.TENANT_ID_ATTRIBUTE), tenantId));
    }

    public boolean hasPermission(AuthenticatedPrincipal principal, String permission) {
        return principal != null && principal.getPermissionSet().contains(permission);
    }

    public boolean hasAnyPermission(AuthenticatedPrincipal principal, Collection<String> permissions) {
        return principal != null && principal.getPermissionSet().containsAny(permissions);
    }

    public boolean hasAllPermissions(AuthenticatedPrincipal principal, Collection<String> permissions) {
        return principal != null && principal.getPermissionSet().containsAll(permissions);
    }

    private static <T extends TenantOwned> Specification<T> tenantEquals(String tenantId) {
        return (root, query, cb) -> cb.equal(root.get(TenantOwned.TENANT_ID_ATTRIBUTE), tenantId);
    }

    private static void requirePrincipal(AuthenticatedPrincipal principal) {
        if (principal == null) {
            throw new ForbiddenException("No authenticated principal");
        }
    }
}

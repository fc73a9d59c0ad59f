package com.salonhub.authservice.services;

import com.salonhub.authservice.exceptions.ForbiddenException;
import com.salonhub.authservice.models.Role;
import com.salonhub.authservice.permissions.Permission;
import com.salonhub.authservice.permissions.PermissionScopeResolver;
import com.salonhub.authservice.repository.RoleRepository;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Reads and edits role permission sets. System roles are readable by everyone who can see them but
 * never editable here. Edits take effect for users on their next token issuance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RolePermissionService {

    private static final String ROLES = "roles";

    private final RoleRepository roleRepository;
    private final PermissionScopeResolver permissionScopeResolver;

    @Transactional(readOnly = true)
    public List<Role> findVisibleRoles(AuthenticatedPrincipal principal) {
        return roleRepository.findAll(permissionScopeResolver.roleScope(principal));
    }

    /**
     * Replace the role's permission set.
     *
     * @throws ForbiddenException       system role, role not visible, or caller lacks {@code roles:update}
     * @throws IllegalArgumentException a permission string is malformed
     */
    @Transactional
    public Role replacePermissions(AuthenticatedPrincipal principal, UUID roleId, Collection<String> permissions) {
        Role role = roleRepository.findById(roleId).orElseThrow(() -> {
            log.info("Role {} not found or not visible to user {}", roleId, principal.getUserId());
            return new ForbiddenException("Role " + roleId + " not accessible");
        });

        if (role.isSystem()) {
            log.warn("User {} attempted to modify system role {}", principal.getUserId(), role.getName());
            throw new ForbiddenException("System role " + role.getName() + " is immutable");
        }

        permissionScopeResolver.requireEntityAccess(principal, role, ROLES, "update");

        if (permissions == null) {
            throw new IllegalArgumentException("Permissions are required");
        }
        Set<String> validated = new TreeSet<>();
        for (String permission : permissions) {
            validated.add(Permission.parseStrict(permission).toString());
        }

        role.getPermissions().clear();
        role.getPermissions().addAll(validated);
        Role saved = roleRepository.save(role);

        log.info("User {} replaced permissions of role {} ({} permissions)",
                principal.getUserId(), role.getId(), validated.size());
        return saved;
    }
}

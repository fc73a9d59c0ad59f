package com.salonhub.authservice.services;

import com.salonhub.authservice.exceptions.ForbiddenException;
import com.salonhub.authservice.models.Role;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import com.salonhub.authservice.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RolePermissionService")
class RolePermissionServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private RolePermissionService rolePermissionService;

    private Role tenantAdminTemplate;
    private Role t1Stylist;
    private Role t2Stylist;

    @BeforeEach
    void createRoles() {
        tenantAdminTemplate = createRole("tenant-admin", null, true, "users:read:own", "roles:update:own");
        t1Stylist = createRole("stylist", "t1", false, "appointments:read:own");
        t2Stylist = createRole("stylist", "t2", false, "appointments:read:own");
    }

    private static AuthenticatedPrincipal principal(String tenantId, String... permissions) {
        return new AuthenticatedPrincipal(UUID.randomUUID(), "admin@salon.test", tenantId, UUID.randomUUID(),
                List.of(permissions));
    }

    @Test
    @DisplayName("tenant users see system roles and their own tenant's roles")
    void visibleRoles() {
        List<Role> roles = rolePermissionService.findVisibleRoles(principal("t1", "roles:read:own"));

        assertThat(roles).extracting(Role::getId)
                .containsExactlyInAnyOrder(tenantAdminTemplate.getId(), t1Stylist.getId());
    }

    @Test
    @DisplayName("super-admin sees every role")
    void superAdminSeesAll() {
        assertThat(rolePermissionService.findVisibleRoles(principal(null))).hasSize(3);
    }

    @Test
    @DisplayName("replaces the permission set of an own-tenant role")
    void replaceOwn() {
        AuthenticatedPrincipal admin = principal("t1", "roles:update:own");

        Role updated = rolePermissionService.replacePermissions(admin, t1Stylist.getId(),
                List.of("appointments:read:own", "appointments:create:own"));

        assertThat(updated.getPermissions()).containsExactlyInAnyOrder("appointments:read:own", "appointments:create:own");
        assertThat(roleRepository.findById(t1Stylist.getId()).orElseThrow().getPermissions())
                .containsExactlyInAnyOrder("appointments:read:own", "appointments:create:own");
    }

    @Test
    @DisplayName("system roles are immutable, even for a super-admin")
    void systemRoleImmutable() {
        assertThatThrownBy(() -> rolePermissionService.replacePermissions(principal(null),
                tenantAdminTemplate.getId(), List.of("users:read:all")))
                .isInstanceOf(ForbiddenException.class);

        assertThat(roleRepository.findById(tenantAdminTemplate.getId()).orElseThrow().getPermissions())
                .containsExactlyInAnyOrder("users:read:own", "roles:update:own");
    }

    @Test
    @DisplayName("another tenant's role cannot be edited with :own")
    void otherTenantRole() {
        assertThatThrownBy(() -> rolePermissionService.replacePermissions(principal("t1", "roles:update:own"),
                t2Stylist.getId(), List.of("appointments:read:all")))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("missing role and missing permission are both forbidden")
    void notFoundOrNotPermitted() {
        assertThatThrownBy(() -> rolePermissionService.replacePermissions(principal("t1", "roles:update:own"),
                UUID.randomUUID(), List.of()))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> rolePermissionService.replacePermissions(principal("t1", "roles:read:own"),
                t1Stylist.getId(), List.of()))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("malformed permission strings are rejected and nothing changes")
    void malformedPermission() {
        assertThatThrownBy(() -> rolePermissionService.replacePermissions(principal("t1", "roles:update:all"),
                t1Stylist.getId(), List.of("appointments:read:own", "Appointments:Delete")))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(roleRepository.findById(t1Stylist.getId()).orElseThrow().getPermissions())
                .containsExactly("appointments:read:own");
    }
}

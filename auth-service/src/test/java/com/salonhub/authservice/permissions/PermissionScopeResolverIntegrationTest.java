package com.salonhub.authservice.permissions;

import com.salonhub.authservice.exceptions.ForbiddenException;
import com.salonhub.authservice.models.Role;
import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import com.salonhub.authservice.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionScopeResolver on real queries")
class PermissionScopeResolverIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private PermissionScopeResolver resolver;

    private UserAccount anaT1;
    private UserAccount benT1;
    private UserAccount carlaT2;

    @BeforeEach
    void createUsers() {
        Role t1Role = createRole("stylist", "t1", false);
        Role t2Role = createRole("stylist", "t2", false);
        anaT1 = createUser("ana@salon.test", "t1", t1Role);
        benT1 = createUser("ben@salon.test", "t1", t1Role);
        carlaT2 = createUser("carla@salon.test", "t2", t2Role);
    }

    private static AuthenticatedPrincipal principal(String tenantId, String... permissions) {
        return new AuthenticatedPrincipal(UUID.randomUUID(), "caller@salon.test", tenantId, UUID.randomUUID(),
                List.of(permissions));
    }

    private static Specification<UserAccount> emailStartsWith(String prefix) {
        return (root, query, cb) -> cb.like(root.get("email"), prefix + "%");
    }

    @Test
    @DisplayName(":own returns only rows of the caller's tenant")
    void ownScope() {
        Specification<UserAccount> spec = resolver.scopeQuery(principal("t1", "users:read:own"), null, "users");

        assertThat(userAccountRepository.findAll(spec)).extracting(UserAccount::getId)
                .containsExactlyInAnyOrder(anaT1.getId(), benT1.getId());
    }

    @Test
    @DisplayName(":own composes with the caller's own filter")
    void ownScopeWithBaseFilter() {
        Specification<UserAccount> spec = resolver.scopeQuery(principal("t2", "users:read:own"),
                emailStartsWith("a"), "users");

        assertThat(userAccountRepository.findAll(spec)).isEmpty();
    }

    @Test
    @DisplayName(":all and super-admin see every tenant")
    void crossTenant() {
        Specification<UserAccount> all = resolver.scopeQuery(principal("t1", "users:read:all"),
                Specification.where(null), "users");
        Specification<UserAccount> superAdmin = resolver.scopeQuery(principal(null), emailStartsWith("c"), "users");

        assertThat(userAccountRepository.findAll(all)).hasSize(3);
        assertThat(userAccountRepository.findAll(superAdmin)).extracting(UserAccount::getId)
                .containsExactly(carlaT2.getId());
    }

    @Test
    @DisplayName("no scope for the action is forbidden before any query runs")
    void forbidden() {
        assertThatThrownBy(() -> resolver.scopeQuery(principal("t1", "users:update:own"),
                Specification.<UserAccount>where(null), "users", "read"))
                .isInstanceOf(ForbiddenException.class);
    }
}

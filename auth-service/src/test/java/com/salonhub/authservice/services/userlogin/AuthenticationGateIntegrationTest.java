package com.salonhub.authservice.services.userlogin;

import com.salonhub.authservice.configurations.AuthProperties;
import com.salonhub.authservice.exceptions.AccountLockedException;
import com.salonhub.authservice.exceptions.InvalidCredentialsException;
import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.exceptions.TenantContextActivationException;
import com.salonhub.authservice.exceptions.TokenExpiredException;
import com.salonhub.authservice.models.Role;
import com.salonhub.authservice.models.SecurityEvent;
import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import com.salonhub.authservice.services.ClientContext;
import com.salonhub.authservice.services.JwtService;
import com.salonhub.authservice.services.TokenPair;
import com.salonhub.authservice.support.AbstractIntegrationTest;
import com.salonhub.authservice.tenancy.TenantContext;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.NestedExceptionUtils;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthenticationGate against the database")
class AuthenticationGateIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private AuthenticationGate gate;

    @Autowired
    private UserLogin userLogin;

    @Autowired
    private AuthProperties authProperties;

    @Autowired
    private JwtService jwtService;

    private final ClientContext client = new ClientContext("198.51.100.4", "JUnit");

    private Role stylist;
    private UserAccount ana;

    @BeforeEach
    void createUsers() {
        stylist = createRole("stylist", "t1", false, "appointments:read:own", "users:read:own");
        ana = createUser("ana@salon.test", "t1", stylist);
    }

    @Nested
    @DisplayName("credentials")
    class Credentials {

        @Test
        @DisplayName("correct password after earlier failures resets the counter")
        void successResets() {
            for (int i = 0; i < 3; i++) {
                assertThatThrownBy(() -> gate.validateCredentials("ana@salon.test", "wrong", null, client))
                        .isInstanceOf(InvalidCredentialsException.class);
            }
            assertThat(reload(ana).getFailedLoginCount()).isEqualTo(3);

            UserAccount user = gate.validateCredentials("ana@salon.test", PASSWORD, null, client);

            assertThat(user.getId()).isEqualTo(ana.getId());
            UserAccount reloaded = reload(ana);
            assertThat(reloaded.getFailedLoginCount()).isZero();
            assertThat(reloaded.getLastLogin()).isEqualTo(now());
        }

        @Test
        @DisplayName("email match ignores case")
        void caseInsensitiveEmail() {
            assertThat(gate.validateCredentials("Ana@Salon.TEST", PASSWORD, null, client).getId())
                    .isEqualTo(ana.getId());
        }

        @Test
        @DisplayName("the fifth failure locks; the sixth attempt is refused as locked even with the right password")
        void lockout() {
            for (int i = 0; i < 5; i++) {
                assertThatThrownBy(() -> gate.validateCredentials("ana@salon.test", "wrong", null, client))
                        .isInstanceOf(InvalidCredentialsException.class);
            }

            assertThatThrownBy(() -> gate.validateCredentials("ana@salon.test", PASSWORD, null, client))
                    .isInstanceOf(AccountLockedException.class)
                    .satisfies(e -> assertThat(((AccountLockedException) e).getRetryAfterSeconds()).isEqualTo(900));

            // locked attempts are not counted
            assertThat(reload(ana).getFailedLoginCount()).isEqualTo(5);
            assertThat(securityEventRepository.findByUserIdAndEventType(ana.getId(), SecurityEvent.Type.ACCOUNT_LOCKED))
                    .hasSize(1);

            clock.advance(Duration.ofMinutes(15).plusSeconds(1));

            assertThat(gate.validateCredentials("ana@salon.test", PASSWORD, null, client).getId())
                    .isEqualTo(ana.getId());
            assertThat(reload(ana).getLockedUntil()).isNull();
        }

        @Test
        @DisplayName("soft-deleted and suspended users cannot log in")
        void inactiveUsers() {
            UserAccount suspended = createUser("sam@salon.test", "t1", stylist);
            suspended.setStatus(UserAccount.Status.SUSPENDED);
            userAccountRepository.save(suspended);

            UserAccount deleted = reload(ana);
            deleted.setDeleted(true);
            deleted.setDeletedAt(now());
            userAccountRepository.save(deleted);

            assertThatThrownBy(() -> gate.validateCredentials("sam@salon.test", PASSWORD, null, client))
                    .isInstanceOf(InvalidCredentialsException.class);
            assertThatThrownBy(() -> gate.validateCredentials("ana@salon.test", PASSWORD, null, client))
                    .isInstanceOf(InvalidCredentialsException.class);
        }

        @Test
        @DisplayName("email registered in two tenants needs the tenant hint")
        void emailInTwoTenants() {
            Role otherRole = createRole("stylist", "t2", false, "users:read:own");
            UserAccount inT2 = createUser("ana@salon.test", "t2", otherRole);

            assertThatThrownBy(() -> gate.validateCredentials("ana@salon.test", PASSWORD, null, client))
                    .isInstanceOf(InvalidCredentialsException.class);

            assertThat(gate.validateCredentials("ana@salon.test", PASSWORD, "t2", client).getId())
                    .isEqualTo(inT2.getId());
            assertThat(gate.validateCredentials("ana@salon.test", PASSWORD, "t1", client).getId())
                    .isEqualTo(ana.getId());
        }

        @Test
        @DisplayName("unknown email fails like a wrong password and records an event")
        void unknownEmail() {
            assertThatThrownBy(() -> gate.validateCredentials("nobody@salon.test", PASSWORD, null, client))
                    .isInstanceOf(InvalidCredentialsException.class);

            assertThat(securityEventRepository.findAll())
                    .extracting(SecurityEvent::getEventType)
                    .containsExactly(SecurityEvent.Type.LOGIN_FAILED);
        }
    }

    @Nested
    @DisplayName("access tokens")
    class AccessTokens {

        @Test
        @DisplayName("valid token yields the principal and activates its tenant")
        void validToken() {
            TokenPair pair = userLogin.login("ana@salon.test", PASSWORD, null, client);
            sessionVariableWriter.reset();

            AuthenticatedPrincipal principal = gate.validateAccessToken(pair.getAccessToken());

            assertThat(principal.getUserId()).isEqualTo(ana.getId());
            assertThat(principal.getTenantId()).isEqualTo("t1");
            assertThat(principal.getRoleId()).isEqualTo(stylist.getId());
            assertThat(principal.getPermissions()).containsExactlyInAnyOrder("appointments:read:own", "users:read:own");
            assertThat(tenantContextManager.currentTenantId()).isEqualTo("t1");
            // the liveness read ran in a transaction scoped to the token's tenant
            List<TenantContext> applied = sessionVariableWriter.applied();
            assertThat(applied).hasSize(1);
            assertThat(applied.get(0).tenantId()).contains("t1");
        }

        @Test
        @DisplayName("no session variable is written when the liveness read is switched off")
        void livenessReadDisabled() {
            TokenPair pair = userLogin.login("ana@salon.test", PASSWORD, null, client);
            sessionVariableWriter.reset();
            authProperties.getAccessToken().setVerifyUserState(false);
            try {
                gate.validateAccessToken(pair.getAccessToken());
            } finally {
                authProperties.getAccessToken().setVerifyUserState(true);
            }

            assertThat(sessionVariableWriter.applied()).isEmpty();
            assertThat(tenantContextManager.currentTenantId()).isEqualTo("t1");
        }

        @Test
        @DisplayName("failure to apply the tenant to the liveness read rejects the token")
        void activationFailure() {
            TokenPair pair = userLogin.login("ana@salon.test", PASSWORD, null, client);
            sessionVariableWriter.failNextApply();

            assertThatThrownBy(() -> gate.validateAccessToken(pair.getAccessToken()))
                    .isInstanceOf(TenantContextActivationException.class);
            assertThat(tenantContextManager.current()).isEmpty();
        }

        @Test
        @DisplayName("super-admin token activates an unscoped context")
        void superAdminToken() {
            Role superAdmin = createRole("super-admin", null, true);
            createUser("root@salonhub.test", null, superAdmin);
            TokenPair pair = userLogin.login("root@salonhub.test", PASSWORD, null, client);

            AuthenticatedPrincipal principal = gate.validateAccessToken(pair.getAccessToken());

            assertThat(principal.isSuperAdmin()).isTrue();
            assertThat(tenantContextManager.current()).hasValueSatisfying(context ->
                    assertThat(context.isUnscoped()).isTrue());
        }

        @Test
        @DisplayName("token expires after its fifteen minutes")
        void expiredToken() {
            TokenPair pair = userLogin.login("ana@salon.test", PASSWORD, null, client);
            clock.advance(Duration.ofMinutes(16));

            assertThatThrownBy(() -> gate.validateAccessToken(pair.getAccessToken()))
                    .isInstanceOf(TokenExpiredException.class);
            assertThat(tenantContextManager.current()).isEmpty();
        }

        @Test
        @DisplayName("tampered or garbage tokens are invalid")
        void tamperedToken() {
            TokenPair pair = userLogin.login("ana@salon.test", PASSWORD, null, client);
            String token = pair.getAccessToken();
            String[] parts = token.split("\\.");
            String tampered = parts[0] + "." + parts[1] + "." + new StringBuilder(parts[2]).reverse();

            assertThatThrownBy(() -> gate.validateAccessToken(tampered)).isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> gate.validateAccessToken("not.a.jwt")).isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> gate.validateAccessToken("")).isInstanceOf(InvalidTokenException.class);
            assertThat(tenantContextManager.current()).isEmpty();
        }

        @Test
        @DisplayName("token of a user suspended after issuance is rejected")
        void suspendedAfterIssuance() {
            TokenPair pair = userLogin.login("ana@salon.test", PASSWORD, null, client);
            UserAccount suspended = reload(ana);
            suspended.setStatus(UserAccount.Status.SUSPENDED);
            userAccountRepository.save(suspended);

            assertThatThrownBy(() -> gate.validateAccessToken(pair.getAccessToken()))
                    .isInstanceOf(InvalidTokenException.class);
            assertThat(tenantContextManager.current()).isEmpty();
        }
    }

    @Nested
    @DisplayName("tenant id format")
    class TenantIdFormat {

        @Test
        @DisplayName("a token whose tenant claim is malformed is an invalid token, not a server error")
        void malformedTenantClaim() {
            UserAccount outsider = UserAccount.builder()
                    .id(UUID.randomUUID())
                    .email("ana@salon.test")
                    .passwordHash("unused")
                    .tenantId("salon.one")
                    .role(stylist)
                    .build();
            String token = jwtService.generateAccessToken(outsider, List.of("users:read:own")).getValue();

            assertThatThrownBy(() -> gate.validateAccessToken(token))
                    .isInstanceOf(InvalidTokenException.class);
            assertThat(tenantContextManager.current()).isEmpty();
            assertThat(sessionVariableWriter.applied()).isEmpty();
        }

        @Test
        @DisplayName("users cannot be stored under a malformed tenant id")
        void malformedTenantOnSave() {
            Role role = createRole("stylist", "t3", false);

            assertThatThrownBy(() -> createUser("bea@salon.test", "salon.one", role))
                    .satisfies(e -> assertThat(NestedExceptionUtils.getMostSpecificCause(e))
                            .isInstanceOf(ConstraintViolationException.class));
            assertThat(userAccountRepository.findAllNotDeletedByEmail("bea@salon.test")).isEmpty();
        }
    }
}

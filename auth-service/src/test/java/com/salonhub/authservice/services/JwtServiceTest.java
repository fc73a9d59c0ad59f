package com.salonhub.authservice.services;

import com.salonhub.authservice.configurations.AuthProperties;
import com.salonhub.authservice.configurations.JwtConfig;
import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.exceptions.TokenExpiredException;
import com.salonhub.authservice.models.Role;
import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;

import java.security.KeyPair;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtService")
class JwtServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final AuthProperties authProperties = new AuthProperties();
    private final MutableClock clock = new MutableClock(NOW);

    private JwtEncoder encoder;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        JwtConfig config = new JwtConfig(authProperties);
        KeyPair keyPair = config.jwtSigningKeyPair();
        encoder = config.jwtEncoder(config.jwkSource(keyPair));
        jwtService = new JwtService(encoder, config.jwtDecoder(keyPair, clock), authProperties, clock);
    }

    private static UserAccount user(String tenantId) {
        return UserAccount.builder()
                .id(UUID.randomUUID())
                .email("ana@salon.test")
                .tenantId(tenantId)
                .role(Role.builder().id(UUID.randomUUID()).name("stylist").tenantId(tenantId).build())
                .build();
    }

    private String sign(JwtClaimsSet.Builder claims) {
        return encoder.encode(JwtEncoderParameters.from(claims.build())).getTokenValue();
    }

    private JwtClaimsSet.Builder baseClaims() {
        return JwtClaimsSet.builder()
                .issuer(authProperties.getJwt().getIssuer())
                .issuedAt(NOW)
                .expiresAt(NOW.plusSeconds(900))
                .subject(UUID.randomUUID().toString())
                .claim(JwtService.CLAIM_ROLE_ID, UUID.randomUUID().toString())
                .claim(JwtService.CLAIM_TOKEN_TYPE, JwtService.ACCESS_TOKEN_TYPE);
    }

    @Test
    @DisplayName("issued token verifies back to the same identity and permission snapshot")
    void verifiesIssuedToken() {
        UserAccount user = user("t1");

        JwtService.SignedAccessToken signed = jwtService.generateAccessToken(user, List.of("users:read:own"));
        VerifiedAccessToken verified = jwtService.verifyAccessToken(signed.getValue());

        assertThat(signed.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(verified.getUserId()).isEqualTo(user.getId());
        assertThat(verified.getTenantId()).isEqualTo("t1");
        assertThat(verified.getRoleId()).isEqualTo(user.getRole().getId());
        assertThat(verified.getPermissions()).containsExactly("users:read:own");
        assertThat(verified.isSuperAdmin()).isFalse();
    }

    @Test
    @DisplayName("super-admin token has no tenant claim")
    void superAdmin() {
        VerifiedAccessToken verified = jwtService.verifyAccessToken(
                jwtService.generateAccessToken(user(null), List.of()).getValue());

        assertThat(verified.isSuperAdmin()).isTrue();
        assertThat(verified.getTenantId()).isNull();
        assertThat(verified.toPrincipal().isSuperAdmin()).isTrue();
    }

    @Test
    @DisplayName("expired token is reported as expired, one second past is enough")
    void expired() {
        String token = jwtService.generateAccessToken(user("t1"), List.of()).getValue();
        clock.advance(Duration.ofMinutes(15).plusSeconds(1));

        assertThatThrownBy(() -> jwtService.verifyAccessToken(token)).isInstanceOf(TokenExpiredException.class);
    }

    @Test
    @DisplayName("missing tenant claim without the super-admin flag is invalid")
    void missingTenantWithoutFlag() {
        String token = sign(baseClaims().claim(JwtService.CLAIM_SUPER_ADMIN, false));

        assertThatThrownBy(() -> jwtService.verifyAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("tenant claim together with the super-admin flag is invalid")
    void tenantWithFlag() {
        String token = sign(baseClaims()
                .claim(JwtService.CLAIM_SUPER_ADMIN, true)
                .claim(JwtService.CLAIM_TENANT_ID, "t1"));

        assertThatThrownBy(() -> jwtService.verifyAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("wrong issuer, wrong token type and foreign signature are invalid")
    void otherDefects() {
        String wrongIssuer = sign(baseClaims().issuer("someone-else").claim(JwtService.CLAIM_TENANT_ID, "t1"));
        String wrongType = sign(baseClaims()
                .claim(JwtService.CLAIM_TOKEN_TYPE, "REFRESH")
                .claim(JwtService.CLAIM_TENANT_ID, "t1"));

        JwtConfig otherConfig = new JwtConfig(authProperties);
        JwtEncoder otherEncoder = otherConfig.jwtEncoder(otherConfig.jwkSource(otherConfig.jwtSigningKeyPair()));
        String foreign = otherEncoder.encode(JwtEncoderParameters.from(
                baseClaims().claim(JwtService.CLAIM_TENANT_ID, "t1").build())).getTokenValue();

        assertThatThrownBy(() -> jwtService.verifyAccessToken(wrongIssuer)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> jwtService.verifyAccessToken(wrongType)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> jwtService.verifyAccessToken(foreign)).isInstanceOf(InvalidTokenException.class);
    }
}

package com.salonhub.authservice.configurations;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    @Valid
    private final Jwt jwt = new Jwt();

    @Valid
    private final RefreshToken refreshToken = new RefreshToken();

    @Valid
    private final Lockout lockout = new Lockout();

    @Valid
    private final AccessToken accessToken = new AccessToken();

    @Valid
    private final Tenancy tenancy = new Tenancy();

    private final Cookie cookie = new Cookie();

    @Getter
    @Setter
    public static class Jwt {
        @NotBlank
        private String issuer = "salonhub-auth-service";

        @NotNull
        private Duration accessTokenTtl = Duration.ofMinutes(15);

        private Resource publicKey;

        private Resource privateKey;
    }

    @Getter
    @Setter
    public static class RefreshToken {
        @NotNull
        private Duration ttl = Duration.ofDays(7);

        @Min(16)
        private int lengthBytes = 32;

        @NotNull
        private Duration revokedRetention = Duration.ofDays(30);
    }

    @Getter
    @Setter
    public static class Lockout {
        @Min(1)
        private int maxFailedAttempts = 5;

        @NotNull
        private Duration lockDuration = Duration.ofMinutes(15);
    }

    @Getter
    @Setter
    public static class AccessToken {
        /** Re-read the user (after tenant activation) to reject deleted or suspended accounts. */
        private boolean verifyUserState = true;
    }

    @Getter
    @Setter
    public static class Tenancy {
        public enum SessionVariableMode {
            POSTGRES,
            NONE
        }

        @NotBlank
        private String sessionVariable = "app.current_tenant_id";

        @NotNull
        private SessionVariableMode sessionVariableMode = SessionVariableMode.POSTGRES;

        @NotNull
        private Duration activationTimeout = Duration.ofSeconds(3);
    }

    @Getter
    @Setter
    public static class Cookie {
        private String refreshTokenName = "refresh_token";

        private String domain;

        private boolean secure = true;

        private String sameSite = "Strict";

        private String path = "/api/v1/auth";
    }
}

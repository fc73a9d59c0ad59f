package com.salonhub.authservice.services;

import com.salonhub.authservice.configurations.AuthProperties;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Transports the refresh token in an HttpOnly cookie scoped to the auth endpoints.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CookiesService {

    private final AuthProperties authProperties;
    private final Environment environment;

    /**
     * Refuse to start in production with insecure cookies.
     */
    @PostConstruct
    public void validateConfiguration() {
        boolean secure = authProperties.getCookie().isSecure();
        if (environment.acceptsProfiles(Profiles.of("prod", "production")) && !secure) {
            throw new IllegalStateException(
                    "Cookie secure flag must be enabled in production. Set auth.cookie.secure=true");
        }

        if (!secure) {
            log.warn("Refresh-token cookie configured with Secure=false; acceptable for local development only");
        }
    }

    public void setRefreshTokenCookie(HttpServletResponse response, String refreshToken) {
        Duration maxAge = authProperties.getRefreshToken().getTtl();
        response.addHeader(HttpHeaders.SET_COOKIE, createCookie(refreshToken, maxAge).toString());
        log.debug("Refresh token cookie set");
    }

    public void clearRefreshTokenCookie(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, createCookie("", Duration.ZERO).toString());
        log.debug("Refresh token cookie cleared");
    }

    private ResponseCookie createCookie(String value, Duration maxAge) {
        AuthProperties.Cookie cookie = authProperties.getCookie();
        ResponseCookie.ResponseCookieBuilder builder = ResponseCookie.from(cookie.getRefreshTokenName(), value)
                .httpOnly(true)
                .secure(cookie.isSecure())
                .path(cookie.getPath())
                .maxAge(maxAge)
                .sameSite(cookie.getSameSite());
        if (cookie.getDomain() != null && !cookie.getDomain().isBlank()) {
            builder.domain(cookie.getDomain());
        }
        return builder.build();
    }
}

package com.salonhub.authservice.controllers;

import com.salonhub.authservice.annotations.RateLimited;
import com.salonhub.authservice.configurations.AuthProperties;
import com.salonhub.authservice.dto.CookieUtil;
import com.salonhub.authservice.dto.auth.LoginRequest;
import com.salonhub.authservice.dto.auth.PrincipalResponse;
import com.salonhub.authservice.dto.auth.RefreshRequest;
import com.salonhub.authservice.dto.auth.RevokeAllResponse;
import com.salonhub.authservice.dto.auth.TokenResponse;
import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import com.salonhub.authservice.services.ClientContext;
import com.salonhub.authservice.services.CookiesService;
import com.salonhub.authservice.services.TokenPair;
import com.salonhub.authservice.services.userlogin.LoginUtilities;
import com.salonhub.authservice.services.userlogin.Logout;
import com.salonhub.authservice.services.userlogin.TokenRotationEngine;
import com.salonhub.authservice.services.userlogin.UserLogin;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class UserLoginController {

    private final UserLogin userLogin;
    private final TokenRotationEngine tokenRotationEngine;
    private final Logout logoutService;
    private final CookiesService cookiesService;
    private final LoginUtilities loginUtilities;
    private final AuthProperties authProperties;

    /**
     * Login with email and password.
     *
     * @param loginRequest email, password and an optional tenant hint
     * @return a fresh access/refresh pair; the refresh token is also set as an HttpOnly cookie
     */
    @PostMapping("/login")
    @RateLimited(requests = 5, perSeconds = 60, bucket = "login",
            message = "Too many login attempts. Please try again in a minute.")
    public ResponseEntity<TokenResponse> login(@RequestBody @Valid LoginRequest loginRequest,
                                               HttpServletRequest request, HttpServletResponse response) {
        ClientContext client = loginUtilities.clientContext(request);
        TokenPair pair = userLogin.login(loginRequest.getEmail(), loginRequest.getPassword(),
                loginRequest.getTenantId(), client);

        cookiesService.setRefreshTokenCookie(response, pair.getRefreshToken());
        return ResponseEntity.ok(TokenResponse.from(pair));
    }

    /**
     * Exchange a refresh token (body, else cookie) for a new pair. The presented token is spent.
     */
    @PostMapping("/refresh")
    @RateLimited(requests = 10, perSeconds = 60, bucket = "refresh",
            message = "Too many refresh requests. Please wait a moment.")
    public ResponseEntity<TokenResponse> refresh(@RequestBody(required = false) RefreshRequest refreshRequest,
                                                 HttpServletRequest request, HttpServletResponse response) {
        String refreshToken = resolveRefreshToken(refreshRequest, request);

        TokenPair pair = tokenRotationEngine.rotate(refreshToken, loginUtilities.clientContext(request));

        cookiesService.setRefreshTokenCookie(response, pair.getRefreshToken());
        return ResponseEntity.ok(TokenResponse.from(pair));
    }

    /**
     * Revoke the caller's refresh token for this session.
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                       @RequestBody(required = false) RefreshRequest refreshRequest,
                                       HttpServletRequest request, HttpServletResponse response) {
        String refreshToken = resolveRefreshToken(refreshRequest, request);

        // Always clear the cookie, even if the token turns out not to be revocable
        cookiesService.clearRefreshTokenCookie(response);
        logoutService.logout(principal.getUserId(), refreshToken, loginUtilities.clientContext(request));
        return ResponseEntity.noContent().build();
    }

    /**
     * Revoke every refresh token of the caller, ending all sessions on all devices.
     */
    @PostMapping("/revoke-all")
    public ResponseEntity<RevokeAllResponse> revokeAll(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                       HttpServletRequest request, HttpServletResponse response) {
        int revoked = logoutService.revokeAllSessions(principal.getUserId(), loginUtilities.clientContext(request));
        cookiesService.clearRefreshTokenCookie(response);
        return ResponseEntity.ok(new RevokeAllResponse(revoked));
    }

    @GetMapping("/me")
    public ResponseEntity<PrincipalResponse> me(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(PrincipalResponse.from(principal));
    }

    private String resolveRefreshToken(RefreshRequest body, HttpServletRequest request) {
        if (body != null && body.getRefreshToken() != null && !body.getRefreshToken().isBlank()) {
            return body.getRefreshToken();
        }
        return CookieUtil.getCookieValue(request, authProperties.getCookie().getRefreshTokenName())
                .orElseThrow(() -> new InvalidTokenException("No refresh token presented"));
    }
}

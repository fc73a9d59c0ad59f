package com.salonhub.authservice.configurations;

import com.salonhub.authservice.dto.CookieUtil;
import com.salonhub.authservice.exceptions.AuthException;
import com.salonhub.authservice.security.AuthenticatedPrincipal;
import com.salonhub.authservice.security.PrincipalAuthenticationToken;
import com.salonhub.authservice.services.userlogin.AuthenticationGate;
import com.salonhub.authservice.tenancy.TenantContextManager;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;

/**
 * Authenticates requests carrying an access token (Bearer header, else the access_token cookie).
 * The tenant context activated by the gate lives exactly as long as the request.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".AUTH_ERROR";
    static final String ACCESS_TOKEN_COOKIE = "access_token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthenticationGate authenticationGate;
    private final TenantContextManager tenantContextManager;
    private final String[] publicEndpoints;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        try {
            String requestPath = request.getRequestURI();

            // Skip token validation for public endpoints
            if (Arrays.stream(publicEndpoints).anyMatch(requestPath::startsWith)) {
                filterChain.doFilter(request, response);
                return;
            }

            String accessToken = resolveToken(request);
            if (accessToken != null) {
                try {
                    AuthenticatedPrincipal principal = authenticationGate.validateAccessToken(accessToken);

                    PrincipalAuthenticationToken authentication = new PrincipalAuthenticationToken(principal);
                    authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    SecurityContextHolder.getContext().setAuthentication(authentication);
                    log.debug("User {} authenticated for {}", principal.getUserId(), requestPath);
                } catch (AuthException e) {
                    log.info("Access token rejected on {}: {}", requestPath, e.getMessage());
                    request.setAttribute(AUTH_ERROR_ATTRIBUTE, e.getErrorCode());
                    SecurityContextHolder.clearContext();
                    tenantContextManager.clear();
                }
            }

            filterChain.doFilter(request, response);
        } finally {
            tenantContextManager.clear();
        }
    }

    private String resolveToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return CookieUtil.getCookieValue(request, ACCESS_TOKEN_COOKIE).orElse(null);
    }
}

package com.salonhub.authservice.services.userlogin;

import com.salonhub.authservice.services.ClientContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component
public class LoginUtilities {

    // Get client IP address from request
    public String getClientIpAddress(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank() && !"unknown".equalsIgnoreCase(xForwardedFor)) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank() && !"unknown".equalsIgnoreCase(xRealIp)) {
            return xRealIp.trim();
        }

        return request.getRemoteAddr();
    }

    // IP and User-Agent, truncated to their column sizes
    public ClientContext clientContext(HttpServletRequest request) {
        if (request == null) {
            return ClientContext.unknown();
        }
        return new ClientContext(getClientIpAddress(request), request.getHeader(HttpHeaders.USER_AGENT));
    }
}

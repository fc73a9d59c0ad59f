package com.salonhub.authservice.configurations;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salonhub.authservice.exceptions.AuthErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;

/**
 * 401 for protected paths reached without a valid access token, in the same problem format as
 * controller errors.
 */
@RequiredArgsConstructor
public class ProblemDetailAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        Object attribute = request.getAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE);
        AuthErrorCode code = attribute instanceof AuthErrorCode ? (AuthErrorCode) attribute : AuthErrorCode.INVALID_TOKEN;

        ProblemDetail problem = ProblemDetail.forStatusAndDetail(code.status(), code.clientMessage());
        problem.setTitle(code.status().getReasonPhrase());
        problem.setType(URI.create("https://salonhub.app/errors/" + code.problemType()));
        problem.setProperty("timestamp", clock.instant().toString());

        response.setStatus(code.status().value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}

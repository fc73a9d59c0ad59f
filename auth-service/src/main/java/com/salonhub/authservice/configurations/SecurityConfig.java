package com.salonhub.authservice.configurations;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salonhub.authservice.services.userlogin.AuthenticationGate;
import com.salonhub.authservice.tenancy.TenantContextManager;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.time.Clock;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final PublicEndpointsConfig publicEndpointsConfig;
    private final TenantContextManager tenantContextManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * Stateless chain: identity comes only from the access token on each request.
     *
     * @param http HttpSecurity
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, AuthenticationGate authenticationGate)
            throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .httpBasic(basic -> basic.disable())
                .formLogin(form -> form.disable())
                .logout(logout -> logout.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(publicEndpointsConfig.getPublicEndpoints()).permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint(new ProblemDetailAuthenticationEntryPoint(objectMapper, clock)))
                .addFilterBefore(new JwtAuthenticationFilter(authenticationGate, tenantContextManager,
                                publicEndpointsConfig.getPublicEndpoints()),
                        UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}

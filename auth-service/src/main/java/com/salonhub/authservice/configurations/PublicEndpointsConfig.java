package com.salonhub.authservice.configurations;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Paths reachable without an access token (login, refresh, health).
 */
@Configuration
@ConfigurationProperties(prefix = "security")
@Getter
@Setter
public class PublicEndpointsConfig {
    private String[] publicEndpoints = new String[0];
}

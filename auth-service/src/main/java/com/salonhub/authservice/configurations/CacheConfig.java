package com.salonhub.authservice.configurations;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.salonhub.authservice.aspects.RateLimitAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    /**
     * Rate limiting buckets keyed by IP and endpoint. Idle buckets are dropped after the longest window.
     */
    @Bean
    public Cache<String, RateLimitAspect.RateLimitBucket> rateLimitCache() {
        return Caffeine.newBuilder()
                .expireAfterAccess(10, TimeUnit.MINUTES)
                .maximumSize(50000)
                .recordStats()
                .build();
    }
}

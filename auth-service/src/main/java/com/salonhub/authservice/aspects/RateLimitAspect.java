package com.salonhub.authservice.aspects;

import com.github.benmanes.caffeine.cache.Cache;
import com.salonhub.authservice.annotations.RateLimited;
import com.salonhub.authservice.exceptions.RateLimitExceededException;
import com.salonhub.authservice.services.userlogin.LoginUtilities;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enforces {@link RateLimited} on controller methods. Each client IP gets one fixed-window counter per
 * bucket; the counters live in Caffeine and are dropped once idle.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitAspect {

    private final Cache<String, RateLimitBucket> rateLimitCache;
    private final LoginUtilities loginUtilities;
    private final Clock clock;

    @Around("@annotation(rateLimited)")
    public Object rateLimit(ProceedingJoinPoint joinPoint, RateLimited rateLimited) throws Throwable {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            log.warn("Rate limit on {} skipped: not inside an HTTP request", joinPoint.getSignature().toShortString());
            return joinPoint.proceed();
        }

        String clientIp = loginUtilities.getClientIpAddress(attributes.getRequest());
        String cacheKey = rateLimited.bucket() + "|" + clientIp;
        Instant now = clock.instant();

        RateLimitBucket bucket = rateLimitCache.get(cacheKey,
                key -> new RateLimitBucket(rateLimited.requests(), Duration.ofSeconds(rateLimited.perSeconds()), now));

        if (!bucket.tryConsume(now)) {
            long retryAfter = bucket.secondsUntilReset(now);
            log.warn("Rate limit hit: bucket={} ip={} limit={}/{}s retryAfter={}s",
                    rateLimited.bucket(), clientIp, rateLimited.requests(), rateLimited.perSeconds(), retryAfter);
            throw new RateLimitExceededException(rateLimited.message(), retryAfter);
        }

        return joinPoint.proceed();
    }

    /**
     * Request counter for one client in one bucket.
     */
    public static final class RateLimitBucket {
        private final int limit;
        private final Duration window;
        private Instant windowStart;
        private int used;

        RateLimitBucket(int limit, Duration window, Instant windowStart) {
            this.limit = limit;
            this.window = window;
            this.windowStart = windowStart;
        }

        synchronized boolean tryConsume(Instant now) {
            if (!now.isBefore(windowStart.plus(window))) {
                windowStart = now;
                used = 0;
            }
            if (used >= limit) {
                return false;
            }
            used++;
            return true;
        }

        synchronized long secondsUntilReset(Instant now) {
            return Math.max(1, Duration.between(now, windowStart.plus(window)).toSeconds());
        }
    }
}

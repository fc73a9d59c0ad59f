package com.salonhub.authservice.services;

import com.salonhub.authservice.configurations.AuthProperties;
import com.salonhub.authservice.models.SecurityEvent;
import com.salonhub.authservice.repository.RefreshTokenRepository;
import com.salonhub.authservice.tenancy.TenantContext;
import com.salonhub.authservice.tenancy.TenantContextManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.function.IntSupplier;

/**
 * Housekeeping for the refresh-token table. Runs across all tenants under an explicit system context.
 * Failures are logged and retried on the next run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenCleanupService {

    private final RefreshTokenRepository refreshTokenRepository;
    private final TenantContextManager tenantContextManager;
    private final SecurityEventService securityEventService;
    private final TransactionTemplate transactionTemplate;
    private final AuthProperties authProperties;
    private final Clock clock;

    // Daily at 03:00
    @Scheduled(cron = "${auth.cleanup.expired-cron:0 0 3 * * *}")
    public void scheduledExpiredCleanup() {
        try {
            cleanupExpiredTokens();
        } catch (RuntimeException e) {
            log.error("Expired refresh-token cleanup failed", e);
        }
    }

    // Weekly, Sunday at 03:30
    @Scheduled(cron = "${auth.cleanup.revoked-cron:0 30 3 * * SUN}")
    public void scheduledRevokedCleanup() {
        try {
            cleanupRevokedTokens();
        } catch (RuntimeException e) {
            log.error("Revoked refresh-token cleanup failed", e);
        }
    }

    /**
     * Delete refresh tokens whose expiry has passed.
     *
     * @return rows deleted
     */
    public int cleanupExpiredTokens() {
        LocalDateTime now = LocalDateTime.now(clock);
        int deleted = runUnscoped("expired-token-cleanup",
                () -> refreshTokenRepository.deleteExpiredBefore(now));
        log.info("Deleted {} expired refresh tokens", deleted);
        return deleted;
    }

    /**
     * Delete revoked refresh tokens older than the retention period.
     *
     * @return rows deleted
     */
    public int cleanupRevokedTokens() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(authProperties.getRefreshToken().getRevokedRetention());
        int deleted = runUnscoped("revoked-token-cleanup",
                () -> refreshTokenRepository.deleteRevokedBefore(cutoff));
        log.info("Deleted {} revoked refresh tokens revoked before {}", deleted, cutoff);
        return deleted;
    }

    private int runUnscoped(String reason, IntSupplier work) {
        tenantContextManager.activate(TenantContext.system(null, reason));
        try {
            securityEventService.record(SecurityEvent.Type.SUPER_ADMIN_CONTEXT, null,
                    "Unscoped system job: " + reason, ClientContext.unknown());
            Integer deleted = transactionTemplate.execute(status -> work.getAsInt());
            return deleted == null ? 0 : deleted;
        } finally {
            tenantContextManager.clear();
        }
    }
}

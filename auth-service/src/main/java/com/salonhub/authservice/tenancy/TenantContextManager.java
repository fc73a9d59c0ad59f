package com.salonhub.authservice.tenancy;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Optional;

/**
 * Holds the tenant context of the current thread. Every transaction begun while a context is active
 * has the tenant session variable applied before its first query.
 */
@Slf4j
@Component
public class TenantContextManager {

    private static final Logger SECURITY_AUDIT = LoggerFactory.getLogger("SECURITY_AUDIT");

    private final ThreadLocal<TenantContext> current = new ThreadLocal<>();

    /**
     * Activate a context for the rest of the unit of work.
     *
     * @throws IllegalStateException when a transaction is already running on this thread, since its
     *                               session variable was fixed when it began
     */
    public void activate(TenantContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Tenant context is required; use an unscoped context for super-admin access");
        }
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Tenant context must be activated before the transaction begins");
        }

        if (context.isUnscoped()) {
            SECURITY_AUDIT.info("Tenant scoping disabled (super-admin context) origin={}", context.origin());
        } else {
            log.debug("Activated tenant context {}", context);
        }
        current.set(context);
    }

    public Optional<TenantContext> current() {
        return Optional.ofNullable(current.get());
    }

    /** Tenant id of the active context, or null when none is active or it is unscoped. */
    public String currentTenantId() {
        TenantContext context = current.get();
        return context == null ? null : context.tenantId().orElse(null);
    }

    public void clear() {
        current.remove();
    }
}

package com.salonhub.authservice.tenancy;

import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Sets the tenant as a transaction-local PostgreSQL setting, which row-level security policies read
 * through {@code current_setting}.
 */
@Slf4j
public class PostgresTenantSessionVariableWriter implements TenantSessionVariableWriter {

    private static final String QUERY_TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    private final String variableName;
    private final Duration timeout;

    public PostgresTenantSessionVariableWriter(String variableName, Duration timeout) {
        this.variableName = variableName;
        this.timeout = timeout;
    }

    @Override
    public void apply(EntityManager entityManager, TenantContext context) {
        entityManager.createNativeQuery("SELECT set_config(:name, :value, true)")
                .setParameter("name", variableName)
                .setParameter("value", context.sessionValue())
                .setHint(QUERY_TIMEOUT_HINT, (int) timeout.toMillis())
                .getSingleResult();
        log.trace("Applied {} = '{}'", variableName, context.sessionValue());
    }
}

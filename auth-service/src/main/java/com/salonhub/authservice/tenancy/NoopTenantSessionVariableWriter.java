package com.salonhub.authservice.tenancy;

import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;

/**
 * For databases without session variables. Isolation then rests on application-level scoping alone.
 */
@Slf4j
public class NoopTenantSessionVariableWriter implements TenantSessionVariableWriter {

    public NoopTenantSessionVariableWriter() {
        log.warn("Tenant session variable disabled: database row-level filtering will not be applied");
    }

    @Override
    public void apply(EntityManager entityManager, TenantContext context) {
        log.trace("Skipping session variable for {}", context);
    }
}

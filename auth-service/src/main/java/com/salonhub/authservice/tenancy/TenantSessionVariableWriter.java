package com.salonhub.authservice.tenancy;

import jakarta.persistence.EntityManager;

/**
 * Applies a tenant context to the database session of a transaction that has just begun.
 */
public interface TenantSessionVariableWriter {

    void apply(EntityManager entityManager, TenantContext context);
}

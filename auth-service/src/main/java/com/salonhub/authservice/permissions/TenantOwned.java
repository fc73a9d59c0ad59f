package com.salonhub.authservice.permissions;

/**
 * An entity partitioned by tenant. A {@code null} tenant id marks a system-level record.
 */
public interface TenantOwned {

    String TENANT_ID_ATTRIBUTE = "tenantId";

    String getTenantId();
}

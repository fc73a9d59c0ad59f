package com.salonhub.authservice.configurations;

import com.salonhub.authservice.tenancy.NoopTenantSessionVariableWriter;
import com.salonhub.authservice.tenancy.PostgresTenantSessionVariableWriter;
import com.salonhub.authservice.tenancy.TenantAwareJpaTransactionManager;
import com.salonhub.authservice.tenancy.TenantContextManager;
import com.salonhub.authservice.tenancy.TenantSessionVariableWriter;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.transaction.TransactionManagerCustomizers;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
public class TenancyConfig {

    @Bean
    public TenantSessionVariableWriter tenantSessionVariableWriter(AuthProperties authProperties) {
        AuthProperties.Tenancy tenancy = authProperties.getTenancy();
        return switch (tenancy.getSessionVariableMode()) {
            case POSTGRES -> new PostgresTenantSessionVariableWriter(
                    tenancy.getSessionVariable(), tenancy.getActivationTimeout());
            case NONE -> new NoopTenantSessionVariableWriter();
        };
    }

    /**
     * Replaces Spring Boot's default JPA transaction manager so that no transaction can start without
     * the current tenant context applied.
     */
    @Bean(name = "transactionManager")
    public PlatformTransactionManager transactionManager(EntityManagerFactory entityManagerFactory,
                                                         TenantContextManager tenantContextManager,
                                                         TenantSessionVariableWriter tenantSessionVariableWriter,
                                                         ObjectProvider<TransactionManagerCustomizers> customizers) {
        TenantAwareJpaTransactionManager transactionManager = new TenantAwareJpaTransactionManager(
                entityManagerFactory, tenantContextManager, tenantSessionVariableWriter);
        customizers.ifAvailable(c -> c.customize(transactionManager));
        return transactionManager;
    }
}

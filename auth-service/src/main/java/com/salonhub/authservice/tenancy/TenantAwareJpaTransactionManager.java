package com.salonhub.authservice.tenancy;

import com.salonhub.authservice.exceptions.TenantContextActivationException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.jpa.EntityManagerHolder;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Optional;

/**
 * JPA transaction manager that makes the active tenant context the first statement of every new
 * transaction. If it cannot be applied the transaction is rolled back and never handed to the caller.
 */
@Slf4j
public class TenantAwareJpaTransactionManager extends JpaTransactionManager {

    private final transient TenantContextManager tenantContextManager;
    private final transient TenantSessionVariableWriter sessionVariableWriter;

    public TenantAwareJpaTransactionManager(EntityManagerFactory entityManagerFactory,
                                            TenantContextManager tenantContextManager,
                                            TenantSessionVariableWriter sessionVariableWriter) {
        super(entityManagerFactory);
        this.tenantContextManager = tenantContextManager;
        this.sessionVariableWriter = sessionVariableWriter;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        super.doBegin(transaction, definition);

        Optional<TenantContext> context = tenantContextManager.current();
        if (context.isEmpty()) {
            return;
        }

        EntityManagerHolder holder = (EntityManagerHolder)
                TransactionSynchronizationManager.getResource(obtainEntityManagerFactory());
        EntityManager entityManager = holder.getEntityManager();
        try {
            sessionVariableWriter.apply(entityManager, context.get());
        } catch (RuntimeException e) {
            log.error("Failed to apply {} to new transaction", context.get(), e);
            abortBegin(transaction, entityManager);
            throw new TenantContextActivationException("Tenant context could not be applied", e);
        }
    }

    private void abortBegin(Object transaction, EntityManager entityManager) {
        try {
            EntityTransaction tx = entityManager.getTransaction();
            if (tx.isActive()) {
                tx.rollback();
            }
        } catch (RuntimeException rollbackFailure) {
            log.warn("Rollback after failed tenant activation failed", rollbackFailure);
        } finally {
            doCleanupAfterCompletion(transaction);
        }
    }
}

package com.salonhub.authservice.repository;

import com.salonhub.authservice.models.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, UUID>, JpaSpecificationExecutor<UserAccount> {

    @Query("SELECT u FROM UserAccount u WHERE LOWER(u.email) = LOWER(:email) AND u.deleted = false")
    List<UserAccount> findAllNotDeletedByEmail(@Param("email") String email);

    @Query("SELECT u FROM UserAccount u WHERE LOWER(u.email) = LOWER(:email) " +
            "AND u.tenantId = :tenantId AND u.deleted = false")
    Optional<UserAccount> findNotDeletedByEmailAndTenantId(@Param("email") String email,
                                                          @Param("tenantId") String tenantId);

    Optional<UserAccount> findByIdAndDeletedFalse(UUID id);

    // runs in its own transaction so the active tenant context is applied before the read
    @Transactional(readOnly = true)
    boolean existsByIdAndDeletedFalseAndStatus(UUID id, UserAccount.Status status);

    Optional<LockState> findLockStateById(UUID id);

    /**
     * Increments the failure counter and, when the new count reaches the threshold, sets the lock, all in
     * one statement. A lock that has already lapsed restarts the count at 1.
     *
     * @return rows affected; 0 when the user no longer exists
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE app_users SET " +
            "failed_login_count = CASE " +
            "  WHEN locked_until IS NOT NULL AND locked_until <= :now THEN 1 " +
            "  ELSE failed_login_count + 1 END, " +
            "locked_until = CASE " +
            "  WHEN (CASE WHEN locked_until IS NOT NULL AND locked_until <= :now THEN 1 " +
            "        ELSE failed_login_count + 1 END) >= :threshold THEN CAST(:lockUntil AS TIMESTAMP) " +
            "  WHEN locked_until IS NOT NULL AND locked_until <= :now THEN NULL " +
            "  ELSE locked_until END " +
            "WHERE id = :id AND is_deleted = false",
            nativeQuery = true)
    int incrementFailedLoginCount(@Param("id") UUID id,
                                  @Param("now") LocalDateTime now,
                                  @Param("threshold") int threshold,
                                  @Param("lockUntil") LocalDateTime lockUntil);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UserAccount u SET u.failedLoginCount = 0, u.lockedUntil = null WHERE u.id = :id")
    int resetFailedLoginCount(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UserAccount u SET u.lastLogin = :lastLogin WHERE u.id = :id")
    int updateLastLogin(@Param("id") UUID id, @Param("lastLogin") LocalDateTime lastLogin);

    interface LockState {
        int getFailedLoginCount();

        LocalDateTime getLockedUntil();
    }
}

package com.salonhub.authservice.repository;

import com.salonhub.authservice.models.RefreshToken;
import com.salonhub.authservice.models.RevocationReason;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Every revoking update filters on {@code revoked = false}, so a revoked row is never written again.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    /** Row-locks the token until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM RefreshToken t WHERE t.tokenHash = :tokenHash")
    Optional<RefreshToken> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    long countByUser_IdAndRevokedFalse(UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken t SET t.revoked = true, t.revokedAt = :now, t.revokedReason = :reason " +
            "WHERE t.id = :id AND t.revoked = false")
    int revokeIfActive(@Param("id") UUID id,
                       @Param("reason") RevocationReason reason,
                       @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken t SET t.revoked = true, t.revokedAt = :now, t.revokedReason = :reason " +
            "WHERE t.tokenHash = :tokenHash AND t.user.id = :userId AND t.revoked = false")
    int revokeIfActiveAndOwnedBy(@Param("tokenHash") String tokenHash,
                                 @Param("userId") UUID userId,
                                 @Param("reason") RevocationReason reason,
                                 @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RefreshToken t SET t.revoked = true, t.revokedAt = :now, t.revokedReason = :reason " +
            "WHERE t.user.id = :userId AND t.revoked = false")
    int revokeAllActiveByUserId(@Param("userId") UUID userId,
                                @Param("reason") RevocationReason reason,
                                @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM RefreshToken t WHERE t.expiresAt < :now")
    int deleteExpiredBefore(@Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM RefreshToken t WHERE t.revoked = true AND t.revokedAt < :cutoff")
    int deleteRevokedBefore(@Param("cutoff") LocalDateTime cutoff);
}

package com.example.tenantsync.repository;

import com.example.tenantsync.entity.TenantSyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for TenantSyncStatus.
 *
 * Lock transitions are single conditional UPDATE statements, so two instances racing for the
 * same tenant cannot both see a successful acquire.
 */
@Repository
public interface TenantSyncStatusRepository extends JpaRepository<TenantSyncStatus, Long> {

    Optional<TenantSyncStatus> findByTenantId(String tenantId);

    long countByStatus(TenantSyncStatus.SyncState status);

    /**
     * Take the lock if it is free, expired, or already held by the same owner (activity retry).
     *
     * @return 1 if acquired, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TenantSyncStatus s SET s.locked = true, s.lockOwner = :owner, " +
            "s.lockedAt = :now, s.lockExpiry = :expiry " +
            "WHERE s.tenantId = :tenantId AND (s.locked = false OR s.lockExpiry IS NULL " +
            "OR s.lockExpiry <= :now OR s.lockOwner = :owner)")
    int acquireLock(@Param("tenantId") String tenantId,
                    @Param("owner") String owner,
                    @Param("now") Instant now,
                    @Param("expiry") Instant expiry);

    /**
     * Unconditional takeover, used by forced syncs.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TenantSyncStatus s SET s.locked = true, s.lockOwner = :owner, " +
            "s.lockedAt = :now, s.lockExpiry = :expiry WHERE s.tenantId = :tenantId")
    int forceAcquireLock(@Param("tenantId") String tenantId,
                         @Param("owner") String owner,
                         @Param("now") Instant now,
                         @Param("expiry") Instant expiry);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TenantSyncStatus s SET s.locked = false, s.lockExpiry = NULL WHERE s.tenantId = :tenantId")
    int releaseLock(@Param("tenantId") String tenantId);

    /**
     * Fail syncs left in progress by a crashed worker: lock expired before the cutoff.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TenantSyncStatus s SET s.status = :failed, s.locked = false, s.lockExpiry = NULL, " +
            "s.errorMessage = :message, s.errorCode = :code, s.lastErrorAt = :now " +
            "WHERE s.status = :inProgress AND s.lockExpiry IS NOT NULL AND s.lockExpiry < :cutoff")
    int markStuckSyncsFailed(@Param("inProgress") TenantSyncStatus.SyncState inProgress,
                             @Param("failed") TenantSyncStatus.SyncState failed,
                             @Param("message") String message,
                             @Param("code") String code,
                             @Param("now") Instant now,
                             @Param("cutoff") Instant cutoff);
}

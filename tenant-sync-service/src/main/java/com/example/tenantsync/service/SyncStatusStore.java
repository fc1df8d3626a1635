package com.example.tenantsync.service;

import com.example.tenantsync.entity.SyncCollection;
import com.example.tenantsync.entity.TenantSyncStatus;
import com.example.tenantsync.exception.ResourceNotFoundException;
import com.example.tenantsync.repository.SyncedRecordRepository;
import com.example.tenantsync.repository.TenantSyncStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistence boundary for per-tenant sync status documents.
 *
 * Writers must re-read before mutating: {@link #update} does the read-mutate-save in one
 * short transaction. Concurrent writers for a tenant are excluded by the sync lock,
 * not by optimistic locking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncStatusStore {

    static final String STUCK_SYNC_CODE = "STUCK_SYNC";

    private final TenantSyncStatusRepository statusRepository;
    private final SyncedRecordRepository syncedRecordRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<TenantSyncStatus> get(String tenantId) {
        return statusRepository.findByTenantId(tenantId);
    }

    /**
     * Return the tenant's status, inserting a pending/independent document if none exists.
     * A concurrent insert that wins the unique constraint is re-read instead of failing.
     */
    public TenantSyncStatus createIfAbsent(String tenantId) {
        Optional<TenantSyncStatus> existing = statusRepository.findByTenantId(tenantId);
        if (existing.isPresent()) {
            return existing.get();
        }

        try {
            TenantSyncStatus created = statusRepository.saveAndFlush(TenantSyncStatus.initial(tenantId));
            log.info("Created sync status for tenantId={}", tenantId);
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("Sync status for tenantId={} created concurrently, re-reading", tenantId);
            return statusRepository.findByTenantId(tenantId)
                    .orElseThrow(() -> e);
        }
    }

    /**
     * Atomic replace of the full document.
     */
    @Transactional
    public TenantSyncStatus save(TenantSyncStatus status) {
        return statusRepository.save(status);
    }

    /**
     * Re-read, mutate and save the tenant's document in one transaction.
     *
     * @throws ResourceNotFoundException if the tenant has no status document
     */
    @Transactional
    public TenantSyncStatus update(String tenantId, Consumer<TenantSyncStatus> mutation) {
        TenantSyncStatus status = statusRepository.findByTenantId(tenantId)
                .orElseThrow(() -> ResourceNotFoundException.syncStatusNotFound(tenantId));
        mutation.accept(status);
        return statusRepository.save(status);
    }

    /**
     * Whether a tenant should be (re)synced: no document yet, a completed sync whose tenant
     * record has gone missing locally, or any state other than a live in-progress run.
     */
    @Transactional(readOnly = true)
    public boolean needsSync(String tenantId) {
        Optional<TenantSyncStatus> found = statusRepository.findByTenantId(tenantId);
        if (found.isEmpty()) {
            return true;
        }

        TenantSyncStatus status = found.get();
        Instant now = clock.instant();
        return switch (status.getStatus()) {
            case COMPLETED -> !syncedRecordRepository.existsByTenantIdAndCollection(tenantId, SyncCollection.TENANTS);
            case IN_PROGRESS -> !status.isLockHeldAt(now);
            case PENDING, FAILED -> true;
        };
    }

    /**
     * Fail in-progress syncs whose lock expired more than {@code threshold} ago and unlock them.
     *
     * @return number of tenants cleaned up
     */
    @Transactional
    public int cleanupStuckSyncs(Duration threshold) {
        Instant now = clock.instant();
        int cleaned = statusRepository.markStuckSyncsFailed(
                TenantSyncStatus.SyncState.IN_PROGRESS,
                TenantSyncStatus.SyncState.FAILED,
                "Sync stuck - lock expired without release",
                STUCK_SYNC_CODE,
                now,
                now.minus(threshold));
        if (cleaned > 0) {
            log.warn("Marked {} stuck syncs as failed (lock expired before {})", cleaned, now.minus(threshold));
        }
        return cleaned;
    }

    /**
     * Tenant count per sync state, plus "total".
     */
    @Transactional(readOnly = true)
    public Map<String, Long> statistics() {
        Map<String, Long> counts = new LinkedHashMap<>();
        long total = 0;
        for (TenantSyncStatus.SyncState state : TenantSyncStatus.SyncState.values()) {
            long count = statusRepository.countByStatus(state);
            counts.put(state.wireValue(), count);
            total += count;
        }
        counts.put("total", total);
        return counts;
    }
}

package com.example.tenantsync.service;

import com.example.tenantsync.repository.TenantSyncStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Time-bounded exclusive lock per tenant, stored on the tenant's sync status row.
 *
 * An expired lock is free for any acquirer. Release is unconditional and must run in a
 * finally block after every phase; the TTL covers workers that crash before releasing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TenantSyncLockManager {

    private final TenantSyncStatusRepository statusRepository;
    private final Clock clock;

    /**
     * @return true if {@code ownerId} now holds the lock until now + ttl
     */
    @Transactional
    public boolean acquireLock(String tenantId, String ownerId, Duration ttl) {
        Instant now = clock.instant();
        boolean acquired = statusRepository.acquireLock(tenantId, ownerId, now, now.plus(ttl)) == 1;
        if (acquired) {
            log.debug("Lock acquired: tenantId={}, owner={}, ttl={}", tenantId, ownerId, ttl);
        } else {
            log.info("Lock busy: tenantId={}, requestedBy={}", tenantId, ownerId);
        }
        return acquired;
    }

    /**
     * Take the lock regardless of its current holder.
     */
    @Transactional
    public boolean forceAcquireLock(String tenantId, String ownerId, Duration ttl) {
        Instant now = clock.instant();
        boolean acquired = statusRepository.forceAcquireLock(tenantId, ownerId, now, now.plus(ttl)) == 1;
        log.warn("Lock force-acquired: tenantId={}, owner={}, acquired={}", tenantId, ownerId, acquired);
        return acquired;
    }

    @Transactional
    public void releaseLock(String tenantId) {
        int updated = statusRepository.releaseLock(tenantId);
        log.debug("Lock released: tenantId={}, rows={}", tenantId, updated);
    }
}

package com.example.tenantsync.activity;

import com.example.tenantsync.client.external.WrapperApiClient;
import com.example.tenantsync.dto.ErrorInfo;
import com.example.tenantsync.dto.PhaseActivityInput;
import com.example.tenantsync.dto.PhaseActivityResult;
import com.example.tenantsync.dto.SyncStats;
import com.example.tenantsync.dto.TenantSyncStatusView;
import com.example.tenantsync.dto.ValidationActivityResult;
import com.example.tenantsync.entity.CollectionProgress;
import com.example.tenantsync.entity.SyncCollection;
import com.example.tenantsync.entity.TenantSyncStatus;
import com.example.tenantsync.metrics.SyncMetrics;
import com.example.tenantsync.service.SyncStatusStore;
import com.example.tenantsync.service.TenantDataSyncGateway;
import com.example.tenantsync.service.TenantSyncLockManager;
import com.example.tenantsync.workflow.SyncErrorTypes;
import io.temporal.failure.ApplicationFailure;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Phase activities: own the status document and lock protocol of a tenant sync and
 * delegate collection transfer to the {@link TenantDataSyncGateway}.
 *
 * CRITICAL DESIGN:
 * - Idempotency checks read without the lock, mutation happens only under it
 * - Lock released in finally after every phase, success or failure
 * - Essential collection failure fails the attempt (retryable); reference failures never do
 * - Store failures propagate as retryable errors
 * - The lock owner carries the attempt number: a retry never re-enters a lock still held
 *   by a timed-out attempt of the same run, it waits for the TTL instead
 */
@Component
@Slf4j
public class TenantSyncActivitiesImpl implements TenantSyncActivities {

    private final SyncStatusStore statusStore;
    private final TenantSyncLockManager lockManager;
    private final TenantDataSyncGateway gateway;
    private final SyncMetrics syncMetrics;
    private final ActivityAttemptSource attemptSource;
    private final Clock clock;
    private final Duration lockTtl;

    public TenantSyncActivitiesImpl(SyncStatusStore statusStore,
                                    TenantSyncLockManager lockManager,
                                    TenantDataSyncGateway gateway,
                                    SyncMetrics syncMetrics,
                                    ActivityAttemptSource attemptSource,
                                    Clock clock,
                                    @Value("${tenant-sync.lock.ttl:30m}") Duration lockTtl) {
        this.statusStore = statusStore;
        this.lockManager = lockManager;
        this.gateway = gateway;
        this.syncMetrics = syncMetrics;
        this.attemptSource = attemptSource;
        this.clock = clock;
        this.lockTtl = lockTtl;
    }

    @Override
    public PhaseActivityResult syncEssentialData(PhaseActivityInput input) {
        requireTenantAndToken(input);
        String tenantId = input.getTenantId();
        String ownerId = ownerOf(input);
        putMdc(tenantId, ownerId);

        try {
            TenantSyncStatus status = statusStore.createIfAbsent(tenantId);

            if (status.isFullySynced() && !input.isForceSync()) {
                log.info("Tenant already synced, skipping essential phase: tenantId={}", tenantId);
                syncMetrics.recordPhaseSkipped(SyncMetrics.PHASE_ESSENTIAL, PhaseActivityResult.ALREADY_SYNCED);
                return PhaseActivityResult.skipped(PhaseActivityResult.ALREADY_SYNCED,
                        statsOf(status, List.of(SyncCollection.values())));
            }

            if (!input.isForceSync() && status.isLockHeldByOtherAt(ownerId, clock.instant())) {
                return skipInProgress(SyncMetrics.PHASE_ESSENTIAL, tenantId, status.getLockOwner());
            }

            if (!takeLock(tenantId, ownerId, input.isForceSync())) {
                return skipInProgress(SyncMetrics.PHASE_ESSENTIAL, tenantId, null);
            }

            try {
                return runEssentialPhase(input);
            } finally {
                releaseLock(tenantId);
            }
        } finally {
            clearMdc();
        }
    }

    private PhaseActivityResult runEssentialPhase(PhaseActivityInput input) {
        String tenantId = input.getTenantId();
        long startTime = clock.millis();
        log.info("Starting essential phase: tenantId={}, forceSync={}", tenantId, input.isForceSync());

        statusStore.update(tenantId, status ->
                status.markEssentialStarted(clock.instant(), input.isForceSync(), input.getTriggerSource()));

        SyncStats stats = SyncStats.builder().build();
        try {
            for (SyncCollection collection : SyncCollection.essentialCollections()) {
                syncCollection(input, collection, stats);
            }
        } catch (RuntimeException e) {
            String code = e instanceof WrapperApiClient.AuthenticationException
                    ? SyncErrorTypes.UPSTREAM_AUTHENTICATION_ERROR
                    : e.getClass().getSimpleName();
            log.error("Essential phase failed: tenantId={}, error={}", tenantId, e.getMessage());
            statusStore.update(tenantId, status -> status.failSync(e.getMessage(), code, clock.instant()));
            syncMetrics.recordPhaseFailure(SyncMetrics.PHASE_ESSENTIAL);
            throw asActivityFailure(e);
        }

        boolean toleratedFailure = false;
        for (SyncCollection collection : SyncCollection.toleratedCollections()) {
            try {
                syncCollection(input, collection, stats);
            } catch (RuntimeException e) {
                toleratedFailure = true;
                log.warn("⚠️ {} sync failed, continuing with partial failure: tenantId={}, error={}",
                        collection.getCollectionName(), tenantId, e.getMessage());
            }
        }

        long durationMs = clock.millis() - startTime;
        boolean partialFailure = toleratedFailure;
        statusStore.update(tenantId, status -> status.markEssentialCompleted(durationMs, partialFailure));

        if (partialFailure) {
            syncMetrics.recordPhasePartialFailure(SyncMetrics.PHASE_ESSENTIAL, durationMs);
        } else {
            syncMetrics.recordPhaseSuccess(SyncMetrics.PHASE_ESSENTIAL, durationMs);
        }
        log.info("Essential phase completed: tenantId={}, records={}, partialFailure={}, duration={}ms",
                tenantId, stats.getTotalRecords(), partialFailure, durationMs);

        return PhaseActivityResult.builder()
                .success(true)
                .stats(stats)
                .error(partialFailure
                        ? ErrorInfo.of("Role assignment sync failed (non-critical)", "PartialFailure")
                        : null)
                .build();
    }

    @Override
    public PhaseActivityResult syncReferenceData(PhaseActivityInput input) {
        requireTenantAndToken(input);
        String tenantId = input.getTenantId();
        String ownerId = ownerOf(input);
        putMdc(tenantId, ownerId);

        try {
            TenantSyncStatus status = statusStore.get(tenantId)
                    .orElseThrow(() -> ApplicationFailure.newNonRetryableFailure(
                            "No sync status for tenant " + tenantId + ", essential data must be synced first",
                            SyncErrorTypes.NOT_FOUND_ERROR));

            if (status.getPhase() == TenantSyncStatus.SyncPhase.INDEPENDENT) {
                throw ApplicationFailure.newNonRetryableFailure(
                        "Essential data must be synced before reference data (tenant " + tenantId
                                + ", phase: independent)",
                        SyncErrorTypes.VALIDATION_ERROR);
            }

            if (status.isReferenceDataSynced() && !input.isForceSync()) {
                log.info("Reference data already synced, skipping: tenantId={}", tenantId);
                syncMetrics.recordPhaseSkipped(SyncMetrics.PHASE_REFERENCE, PhaseActivityResult.ALREADY_SYNCED);
                return PhaseActivityResult.skipped(PhaseActivityResult.ALREADY_SYNCED,
                        statsOf(status, SyncCollection.referenceCollections()));
            }

            if (!input.isForceSync() && status.isLockHeldByOtherAt(ownerId, clock.instant())) {
                return skipInProgress(SyncMetrics.PHASE_REFERENCE, tenantId, status.getLockOwner());
            }

            if (!takeLock(tenantId, ownerId, input.isForceSync())) {
                return skipInProgress(SyncMetrics.PHASE_REFERENCE, tenantId, null);
            }

            try {
                List<SyncCollection> targets = SyncCollection.referenceCollections().stream()
                        .filter(collection -> input.isForceSync() || !status.progressOf(collection).isCompleted())
                        .toList();
                return runReferencePhase(input, targets);
            } finally {
                releaseLock(tenantId);
            }
        } finally {
            clearMdc();
        }
    }

    private PhaseActivityResult runReferencePhase(PhaseActivityInput input, List<SyncCollection> targets) {
        String tenantId = input.getTenantId();
        long startTime = clock.millis();
        log.info("Starting reference phase: tenantId={}, collections={}", tenantId,
                targets.stream().map(SyncCollection::getCollectionName).toList());

        SyncStats stats = SyncStats.builder().build();
        for (SyncCollection collection : targets) {
            try {
                syncCollection(input, collection, stats);
            } catch (RuntimeException e) {
                log.warn("⚠️ Reference collection {} failed (non-critical): tenantId={}, error={}",
                        collection.getCollectionName(), tenantId, e.getMessage());
            }
        }

        long durationMs = clock.millis() - startTime;
        boolean referenceFailure = !stats.getFailedCollections().isEmpty();
        statusStore.update(tenantId, status ->
                status.markReferenceCompleted(clock.instant(), durationMs, referenceFailure));

        if (referenceFailure) {
            syncMetrics.recordPhasePartialFailure(SyncMetrics.PHASE_REFERENCE, durationMs);
            return PhaseActivityResult.builder()
                    .success(false)
                    .stats(stats)
                    .error(ErrorInfo.of("Reference collections failed: "
                            + String.join(", ", stats.getFailedCollections()), "PartialFailure"))
                    .build();
        }

        syncMetrics.recordPhaseSuccess(SyncMetrics.PHASE_REFERENCE, durationMs);
        log.info("Reference phase completed: tenantId={}, records={}, duration={}ms",
                tenantId, stats.getTotalRecords(), durationMs);
        return PhaseActivityResult.builder().success(true).stats(stats).build();
    }

    @Override
    public ValidationActivityResult validateSyncCompletion(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw ApplicationFailure.newNonRetryableFailure("tenantId is required", SyncErrorTypes.VALIDATION_ERROR);
        }

        Optional<TenantSyncStatus> found = statusStore.get(tenantId);
        if (found.isEmpty()) {
            log.warn("Validation requested for tenant without sync status: tenantId={}", tenantId);
            return ValidationActivityResult.builder()
                    .success(false)
                    .valid(false)
                    .issues(new ArrayList<>(List.of("No sync status found for tenant " + tenantId)))
                    .error(ErrorInfo.of("No sync status found for tenant " + tenantId, SyncErrorTypes.NOT_FOUND_ERROR))
                    .build();
        }

        TenantSyncStatus status = found.get();
        List<String> issues = new ArrayList<>();
        boolean blocking = false;

        for (SyncCollection collection : SyncCollection.essentialCollections()) {
            CollectionProgress progress = status.progressOf(collection);
            if (!progress.isCompleted()) {
                issues.add(String.format("Essential collection %s not synced (status: %s)",
                        collection.getCollectionName(), progress.getStatus().wireValue()));
                blocking = true;
            }
        }

        for (SyncCollection collection : SyncCollection.referenceCollections()) {
            CollectionProgress progress = status.progressOf(collection);
            if (!progress.isCompleted()) {
                issues.add(String.format("Reference collection %s not synced (status: %s) (non-critical)",
                        collection.getCollectionName(), progress.getStatus().wireValue()));
            }
        }

        if (status.getStatus() != TenantSyncStatus.SyncState.COMPLETED) {
            issues.add(String.format("Overall sync status is %s, expected 'completed'",
                    status.getStatus().wireValue()));
            blocking = true;
        }

        log.info("Validation for tenantId={}: valid={}, issues={}", tenantId, !blocking, issues.size());
        return ValidationActivityResult.builder()
                .success(true)
                .valid(!blocking)
                .issues(issues)
                .syncStatus(TenantSyncStatusView.from(status))
                .build();
    }

    /**
     * Sync one collection and record its outcome on the status document.
     * Rethrows the failure after recording it.
     */
    private void syncCollection(PhaseActivityInput input, SyncCollection collection, SyncStats stats) {
        String tenantId = input.getTenantId();
        statusStore.update(tenantId, status -> status.markCollectionInProgress(collection));

        int count;
        try {
            count = gateway.syncCollection(tenantId, input.getAuthToken(), collection);
        } catch (RuntimeException e) {
            stats.getFailedCollections().add(collection.getCollectionName());
            syncMetrics.recordCollectionFailure(collection.getCollectionName());
            statusStore.update(tenantId, status ->
                    status.recordCollectionFailure(collection, e.getMessage(), clock.instant()));
            throw e;
        }

        statusStore.update(tenantId, status -> status.recordCollectionSuccess(collection, count, clock.instant()));
        stats.getRecordCounts().put(collection.getCollectionName(), count);
        stats.setTotalRecords(stats.getTotalRecords() + count);
    }

    private boolean takeLock(String tenantId, String ownerId, boolean forceSync) {
        return forceSync
                ? lockManager.forceAcquireLock(tenantId, ownerId, lockTtl)
                : lockManager.acquireLock(tenantId, ownerId, lockTtl);
    }

    private void releaseLock(String tenantId) {
        try {
            lockManager.releaseLock(tenantId);
        } catch (RuntimeException e) {
            log.error("Failed to release sync lock, it will expire after {}: tenantId={}, error={}",
                    lockTtl, tenantId, e.getMessage(), e);
        }
    }

    private PhaseActivityResult skipInProgress(String phase, String tenantId, String holder) {
        log.info("Sync already in progress, skipping {} phase: tenantId={}, lockOwner={}", phase, tenantId, holder);
        syncMetrics.recordPhaseSkipped(phase, PhaseActivityResult.SYNC_IN_PROGRESS);
        return PhaseActivityResult.skipped(PhaseActivityResult.SYNC_IN_PROGRESS, null);
    }

    private static SyncStats statsOf(TenantSyncStatus status, Collection<SyncCollection> collections) {
        SyncStats stats = SyncStats.builder().build();
        for (SyncCollection collection : collections) {
            CollectionProgress progress = status.progressOf(collection);
            stats.getRecordCounts().put(collection.getCollectionName(), progress.getRecordCount());
            stats.setTotalRecords(stats.getTotalRecords() + progress.getRecordCount());
            if (progress.getStatus() == TenantSyncStatus.SyncState.FAILED) {
                stats.getFailedCollections().add(collection.getCollectionName());
            }
        }
        return stats;
    }

    private static RuntimeException asActivityFailure(RuntimeException e) {
        if (e instanceof WrapperApiClient.AuthenticationException) {
            return ApplicationFailure.newNonRetryableFailureWithCause(
                    e.getMessage(), SyncErrorTypes.UPSTREAM_AUTHENTICATION_ERROR, e);
        }
        return e;
    }

    private static void requireTenantAndToken(PhaseActivityInput input) {
        if (input == null || input.getTenantId() == null || input.getTenantId().isBlank()) {
            throw ApplicationFailure.newNonRetryableFailure("tenantId is required", SyncErrorTypes.VALIDATION_ERROR);
        }
        if (input.getAuthToken() == null || input.getAuthToken().isBlank()) {
            throw ApplicationFailure.newNonRetryableFailure("authToken is required", SyncErrorTypes.VALIDATION_ERROR);
        }
    }

    private String ownerOf(PhaseActivityInput input) {
        if (input.getOwnerId() != null && !input.getOwnerId().isBlank()) {
            return input.getOwnerId() + "#" + attemptSource.currentAttempt();
        }
        return "activity-" + UUID.randomUUID();
    }

    private static void putMdc(String tenantId, String ownerId) {
        MDC.put("tenantId", tenantId);
        MDC.put("correlationId", ownerId);
    }

    private static void clearMdc() {
        MDC.remove("tenantId");
        MDC.remove("correlationId");
    }
}

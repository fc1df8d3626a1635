package com.example.tenantsync.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-tenant sync progress, lock state and per-collection outcomes.
 *
 * One row per tenant, created lazily on the first essential-phase attempt and never
 * deleted by the sync engine. Lock columns are only written through the atomic
 * conditional updates in TenantSyncStatusRepository.
 */
@Entity
@Table(name = "tenant_sync_status",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_tenant_sync_status_tenant", columnNames = {"tenant_id"})
        },
        indexes = {
                @Index(name = "idx_tenant_sync_status_status", columnList = "status"),
                @Index(name = "idx_tenant_sync_status_lock_expiry", columnList = "lock_expiry")
        })
@Getter
@Setter
@NoArgsConstructor
public class TenantSyncStatus extends BaseEntity {

    private static final Duration RETRY_BASE_DELAY = Duration.ofMinutes(1);
    private static final Duration RETRY_MAX_DELAY = Duration.ofHours(1);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SyncState status;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, length = 20)
    private SyncPhase phase;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tenant_sync_collection",
            joinColumns = @JoinColumn(name = "sync_status_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "collection_name", length = 50)
    private Map<SyncCollection, CollectionProgress> collections = new EnumMap<>(SyncCollection.class);

    // Lock
    @Column(name = "lock_locked", nullable = false)
    private boolean locked;

    @Column(name = "lock_owner", length = 255)
    private String lockOwner;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "lock_expiry")
    private Instant lockExpiry;

    // Attempts
    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "total_records", nullable = false)
    private int totalRecords;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "partial_failure", nullable = false)
    private boolean partialFailure;

    @Column(name = "trigger_source", length = 20)
    private String triggerSource;

    // Last error
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "error_code", length = 100)
    private String errorCode;

    @Column(name = "last_error_at")
    private Instant lastErrorAt;

    /**
     * Fresh document: pending, independent phase, every collection pending.
     */
    public static TenantSyncStatus initial(String tenantId) {
        TenantSyncStatus status = new TenantSyncStatus();
        status.tenantId = tenantId;
        status.status = SyncState.PENDING;
        status.phase = SyncPhase.INDEPENDENT;
        for (SyncCollection collection : SyncCollection.values()) {
            status.collections.put(collection, CollectionProgress.pending());
        }
        return status;
    }

    public CollectionProgress progressOf(SyncCollection collection) {
        CollectionProgress progress = collections.get(collection);
        return progress != null ? progress : CollectionProgress.pending();
    }

    /**
     * A lock counts as held only while its expiry lies in the future, whatever the stored flag says.
     */
    public boolean isLockHeldAt(Instant now) {
        return locked && lockExpiry != null && lockExpiry.isAfter(now);
    }

    public boolean isLockHeldByOtherAt(String ownerId, Instant now) {
        return isLockHeldAt(now) && (lockOwner == null || !lockOwner.equals(ownerId));
    }

    public boolean isFullySynced() {
        return status == SyncState.COMPLETED && phase == SyncPhase.COMPLETED;
    }

    public boolean isReferenceDataSynced() {
        return SyncCollection.referenceCollections().stream()
                .allMatch(collection -> progressOf(collection).isCompleted());
    }

    /**
     * Start of an essential-phase attempt. Only a forced sync resets the phase.
     */
    public void markEssentialStarted(Instant now, boolean forceSync, String triggerSource) {
        this.status = SyncState.IN_PROGRESS;
        this.attemptCount++;
        this.lastAttemptAt = now;
        this.nextAttemptAt = null;
        this.partialFailure = false;
        this.triggerSource = triggerSource;
        if (forceSync) {
            this.phase = SyncPhase.INDEPENDENT;
        }
    }

    public void markCollectionInProgress(SyncCollection collection) {
        CollectionProgress progress = progressOf(collection);
        progress.setStatus(SyncState.IN_PROGRESS);
        progress.setError(null);
        collections.put(collection, progress);
    }

    public void recordCollectionSuccess(SyncCollection collection, int recordCount, Instant now) {
        collections.put(collection, new CollectionProgress(SyncState.COMPLETED, recordCount, now, null));
        recalculateTotalRecords();
    }

    public void recordCollectionFailure(SyncCollection collection, String error, Instant now) {
        CollectionProgress previous = progressOf(collection);
        collections.put(collection,
                new CollectionProgress(SyncState.FAILED, previous.getRecordCount(), now, truncate(error, 1000)));
        recalculateTotalRecords();
    }

    /**
     * Essential collections done: the tenant is usable, reference data may follow.
     */
    public void markEssentialCompleted(long durationMs, boolean toleratedFailure) {
        this.status = SyncState.COMPLETED;
        this.durationMs = durationMs;
        this.partialFailure = toleratedFailure;
        advancePhase(SyncPhase.DEPENDENT);
    }

    /**
     * End of a reference-phase attempt. The phase only reaches COMPLETED when every
     * targeted reference collection succeeded; otherwise it stays DEPENDENT, so the tenant
     * is not fully synced and the next run redoes it.
     */
    public void markReferenceCompleted(Instant now, long durationMs, boolean referenceFailure) {
        this.status = SyncState.COMPLETED;
        this.durationMs = durationMs;
        this.partialFailure = this.partialFailure || referenceFailure;
        if (!referenceFailure) {
            this.completedAt = now;
            advancePhase(SyncPhase.COMPLETED);
        }
    }

    /**
     * Record a failed attempt and schedule the next one with exponential backoff
     * (1 minute doubling per attempt, capped at 1 hour).
     */
    public void failSync(String message, String code, Instant now) {
        this.status = SyncState.FAILED;
        this.errorMessage = message != null ? message : "Unknown error";
        this.errorCode = code;
        this.lastErrorAt = now;
        this.nextAttemptAt = now.plus(retryDelay(attemptCount));
    }

    /**
     * Moves the phase forward; a target at or behind the current phase is ignored.
     */
    public void advancePhase(SyncPhase target) {
        if (phase == null || target.ordinal() > phase.ordinal()) {
            this.phase = target;
        }
    }

    static Duration retryDelay(int attemptCount) {
        int exponent = Math.max(0, Math.min(attemptCount - 1, 10));
        Duration delay = RETRY_BASE_DELAY.multipliedBy(1L << exponent);
        return delay.compareTo(RETRY_MAX_DELAY) > 0 ? RETRY_MAX_DELAY : delay;
    }

    private void recalculateTotalRecords() {
        this.totalRecords = collections.values().stream()
                .mapToInt(CollectionProgress::getRecordCount)
                .sum();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    public enum SyncState {
        PENDING,
        IN_PROGRESS,
        COMPLETED,
        FAILED;

        public String wireValue() {
            return name().toLowerCase();
        }
    }

    /**
     * INDEPENDENT precedes DEPENDENT, DEPENDENT precedes COMPLETED.
     */
    public enum SyncPhase {
        INDEPENDENT,
        DEPENDENT,
        COMPLETED;

        public String wireValue() {
            return name().toLowerCase();
        }
    }
}

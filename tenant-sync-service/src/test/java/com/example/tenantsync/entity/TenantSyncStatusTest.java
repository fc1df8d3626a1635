package com.example.tenantsync.entity;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TenantSyncStatusTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void initial_IsPendingIndependentWithAllCollectionsPending() {
        TenantSyncStatus status = TenantSyncStatus.initial("tenant-1");

        assertThat(status.getStatus()).isEqualTo(TenantSyncStatus.SyncState.PENDING);
        assertThat(status.getPhase()).isEqualTo(TenantSyncStatus.SyncPhase.INDEPENDENT);
        assertThat(status.getCollections()).hasSize(SyncCollection.values().length);
        assertThat(status.getCollections().values())
                .allMatch(progress -> progress.getStatus() == TenantSyncStatus.SyncState.PENDING);
        assertThat(status.isFullySynced()).isFalse();
    }

    @Test
    void retryDelay_DoublesFromOneMinuteAndCapsAtOneHour() {
        assertThat(TenantSyncStatus.retryDelay(1)).isEqualTo(Duration.ofMinutes(1));
        assertThat(TenantSyncStatus.retryDelay(2)).isEqualTo(Duration.ofMinutes(2));
        assertThat(TenantSyncStatus.retryDelay(3)).isEqualTo(Duration.ofMinutes(4));
        assertThat(TenantSyncStatus.retryDelay(6)).isEqualTo(Duration.ofMinutes(32));
        assertThat(TenantSyncStatus.retryDelay(7)).isEqualTo(Duration.ofHours(1));
        assertThat(TenantSyncStatus.retryDelay(50)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void failSync_SchedulesNextAttemptFromAttemptCount() {
        TenantSyncStatus status = TenantSyncStatus.initial("tenant-1");
        status.markEssentialStarted(NOW, false, "api");
        status.markEssentialStarted(NOW, false, "api");
        status.markEssentialStarted(NOW, false, "api");

        status.failSync("upstream down", "WrapperApiException", NOW);

        assertThat(status.getStatus()).isEqualTo(TenantSyncStatus.SyncState.FAILED);
        assertThat(status.getAttemptCount()).isEqualTo(3);
        assertThat(status.getNextAttemptAt()).isEqualTo(NOW.plus(Duration.ofMinutes(4)));
        assertThat(status.getErrorMessage()).isEqualTo("upstream down");
        assertThat(status.getErrorCode()).isEqualTo("WrapperApiException");
        assertThat(status.getLastErrorAt()).isEqualTo(NOW);
    }

    @Test
    void advancePhase_NeverMovesBackwards() {
        TenantSyncStatus status = TenantSyncStatus.initial("tenant-1");

        status.advancePhase(TenantSyncStatus.SyncPhase.COMPLETED);
        status.advancePhase(TenantSyncStatus.SyncPhase.DEPENDENT);
        status.advancePhase(TenantSyncStatus.SyncPhase.INDEPENDENT);

        assertThat(status.getPhase()).isEqualTo(TenantSyncStatus.SyncPhase.COMPLETED);
    }

    @Test
    void markReferenceCompleted_WithFailure_KeepsDependentPhase() {
        TenantSyncStatus status = TenantSyncStatus.initial("tenant-1");
        status.markEssentialCompleted(100, false);

        status.markReferenceCompleted(NOW, 50, true);

        assertThat(status.getPhase()).isEqualTo(TenantSyncStatus.SyncPhase.DEPENDENT);
        assertThat(status.getStatus()).isEqualTo(TenantSyncStatus.SyncState.COMPLETED);
        assertThat(status.isPartialFailure()).isTrue();
        assertThat(status.getCompletedAt()).isNull();
        assertThat(status.isFullySynced()).isFalse();

        status.markReferenceCompleted(NOW, 20, false);

        assertThat(status.getPhase()).isEqualTo(TenantSyncStatus.SyncPhase.COMPLETED);
        assertThat(status.getCompletedAt()).isEqualTo(NOW);
        assertThat(status.isFullySynced()).isTrue();
    }

    @Test
    void markEssentialStarted_ResetsPhaseOnlyWhenForced() {
        TenantSyncStatus status = TenantSyncStatus.initial("tenant-1");
        status.markEssentialCompleted(100, false);
        status.markReferenceCompleted(NOW, 50, false);

        status.markEssentialStarted(NOW, false, "auto");
        assertThat(status.getPhase()).isEqualTo(TenantSyncStatus.SyncPhase.COMPLETED);

        status.markEssentialStarted(NOW, true, "manual");
        assertThat(status.getPhase()).isEqualTo(TenantSyncStatus.SyncPhase.INDEPENDENT);
        assertThat(status.getStatus()).isEqualTo(TenantSyncStatus.SyncState.IN_PROGRESS);
        assertThat(status.getTriggerSource()).isEqualTo("manual");
    }

    @Test
    void isLockHeldAt_ExpiredLockIsFreeWhateverTheFlag() {
        TenantSyncStatus status = TenantSyncStatus.initial("tenant-1");
        status.setLocked(true);
        status.setLockOwner("wf-1:run-1");
        status.setLockExpiry(NOW.plusSeconds(60));

        assertThat(status.isLockHeldAt(NOW)).isTrue();
        assertThat(status.isLockHeldByOtherAt("wf-1:run-1", NOW)).isFalse();
        assertThat(status.isLockHeldByOtherAt("wf-2:run-1", NOW)).isTrue();

        assertThat(status.isLockHeldAt(NOW.plusSeconds(60))).isFalse();
        assertThat(status.isLockHeldByOtherAt("wf-2:run-1", NOW.plusSeconds(61))).isFalse();
    }

    @Test
    void collectionOutcomes_KeepTotalRecordsInStep() {
        TenantSyncStatus status = TenantSyncStatus.initial("tenant-1");

        status.recordCollectionSuccess(SyncCollection.USERS, 40, NOW);
        status.recordCollectionSuccess(SyncCollection.ROLES, 5, NOW);
        status.recordCollectionFailure(SyncCollection.USERS, "timeout", NOW);

        assertThat(status.getTotalRecords()).isEqualTo(45);
        assertThat(status.progressOf(SyncCollection.USERS).getStatus()).isEqualTo(TenantSyncStatus.SyncState.FAILED);
        assertThat(status.progressOf(SyncCollection.USERS).getRecordCount()).isEqualTo(40);
        assertThat(status.progressOf(SyncCollection.USERS).getError()).isEqualTo("timeout");
    }

    @Test
    void isReferenceDataSynced_RequiresEveryReferenceCollection() {
        TenantSyncStatus status = TenantSyncStatus.initial("tenant-1");
        for (SyncCollection collection : SyncCollection.referenceCollections()) {
            status.recordCollectionSuccess(collection, 1, NOW);
        }
        assertThat(status.isReferenceDataSynced()).isTrue();

        status.recordCollectionFailure(SyncCollection.ROLE_ASSIGNMENTS, "boom", NOW);
        assertThat(status.isReferenceDataSynced()).isFalse();
    }
}

package com.example.tenantsync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Sync outcome of one collection for one tenant.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CollectionProgress {

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TenantSyncStatus.SyncState status;

    @Column(name = "record_count", nullable = false)
    private int recordCount;

    @Column(name = "last_sync_at")
    private Instant lastSyncAt;

    @Column(name = "error", length = 1000)
    private String error;

    public static CollectionProgress pending() {
        return new CollectionProgress(TenantSyncStatus.SyncState.PENDING, 0, null, null);
    }

    public boolean isCompleted() {
        return status == TenantSyncStatus.SyncState.COMPLETED;
    }
}

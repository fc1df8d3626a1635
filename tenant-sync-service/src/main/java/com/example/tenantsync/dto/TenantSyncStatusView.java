package com.example.tenantsync.dto;

import com.example.tenantsync.entity.CollectionProgress;
import com.example.tenantsync.entity.SyncCollection;
import com.example.tenantsync.entity.TenantSyncStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Detached snapshot of a tenant's sync status, safe to return from activities and the REST API.
 * Timestamps are ISO-8601 strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantSyncStatusView {

    private String tenantId;
    private String status;
    private String phase;
    private Map<String, CollectionView> collections;
    private boolean locked;
    private String lockOwner;
    private String lockExpiry;
    private int attemptCount;
    private String lastAttemptAt;
    private String nextAttemptAt;
    private String completedAt;
    private int totalRecords;
    private Long durationMs;
    private boolean partialFailure;
    private String triggerSource;
    private String errorMessage;
    private String errorCode;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CollectionView {
        private String status;
        private int recordCount;
        private String lastSyncAt;
        private String error;
    }

    public static TenantSyncStatusView from(TenantSyncStatus entity) {
        Map<String, CollectionView> collections = new LinkedHashMap<>();
        for (SyncCollection collection : SyncCollection.values()) {
            CollectionProgress progress = entity.progressOf(collection);
            collections.put(collection.getCollectionName(), new CollectionView(
                    progress.getStatus().wireValue(),
                    progress.getRecordCount(),
                    iso(progress.getLastSyncAt()),
                    progress.getError()));
        }

        return TenantSyncStatusView.builder()
                .tenantId(entity.getTenantId())
                .status(entity.getStatus().wireValue())
                .phase(entity.getPhase().wireValue())
                .collections(collections)
                .locked(entity.isLocked())
                .lockOwner(entity.getLockOwner())
                .lockExpiry(iso(entity.getLockExpiry()))
                .attemptCount(entity.getAttemptCount())
                .lastAttemptAt(iso(entity.getLastAttemptAt()))
                .nextAttemptAt(iso(entity.getNextAttemptAt()))
                .completedAt(iso(entity.getCompletedAt()))
                .totalRecords(entity.getTotalRecords())
                .durationMs(entity.getDurationMs())
                .partialFailure(entity.isPartialFailure())
                .triggerSource(entity.getTriggerSource())
                .errorMessage(entity.getErrorMessage())
                .errorCode(entity.getErrorCode())
                .build();
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}

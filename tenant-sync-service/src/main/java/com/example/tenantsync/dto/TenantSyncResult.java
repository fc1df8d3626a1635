package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one tenant sync workflow run.
 *
 * success is true iff the essential phase completed or was skipped as already synced.
 * Times are epoch milliseconds from workflow time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantSyncResult {

    private String tenantId;

    private String workflowId;

    private String runId;

    @Builder.Default
    private SyncPhaseReports phases = new SyncPhaseReports();

    private long startTime;

    private long endTime;

    private long durationMs;

    private boolean success;

    private ErrorInfo error;
}

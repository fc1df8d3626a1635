package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of the essential or reference sync activity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseActivityResult {

    public static final String ALREADY_SYNCED = "already_synced";
    public static final String SYNC_IN_PROGRESS = "sync_in_progress";

    private boolean success;

    private boolean skipped;

    private String reason;

    private SyncStats stats;

    private ErrorInfo error;

    public static PhaseActivityResult skipped(String reason, SyncStats stats) {
        return PhaseActivityResult.builder()
                .success(true)
                .skipped(true)
                .reason(reason)
                .stats(stats)
                .build();
    }

    public boolean isSkippedAs(String skipReason) {
        return skipped && skipReason.equals(reason);
    }
}

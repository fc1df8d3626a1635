package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller options for a tenant sync run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncOptions {

    /**
     * Re-sync even if already completed, taking over any held lock.
     */
    private boolean forceSync;

    private boolean skipReferenceData;

    public static SyncOptions defaults() {
        return new SyncOptions(false, false);
    }
}

package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of the essential and reference sync activities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseActivityInput {

    private String tenantId;

    private String authToken;

    private boolean forceSync;

    /**
     * Lock owner id. Stable across retries of the same workflow run so a retried
     * activity can re-acquire its own lock.
     */
    private String ownerId;

    private String triggerSource;
}

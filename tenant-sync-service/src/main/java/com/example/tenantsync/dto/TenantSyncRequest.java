package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of the tenant sync workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantSyncRequest {

    private String tenantId;

    /**
     * Bearer token forwarded to the wrapper API.
     */
    private String authToken;

    private SyncOptions options;

    /**
     * Who asked for the run: api, manual, auto, workflow.
     */
    private String triggerSource;
}

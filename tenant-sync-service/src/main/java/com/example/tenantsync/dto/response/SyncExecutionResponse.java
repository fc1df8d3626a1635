package com.example.tenantsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifies a workflow execution started or signalled on behalf of a caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncExecutionResponse {

    private String tenantId;

    private String workflowId;

    private String runId;

    private String message;
}

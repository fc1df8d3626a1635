package com.example.tenantsync.workflow;

import com.example.tenantsync.dto.TenantSyncRequest;
import com.example.tenantsync.dto.TenantSyncResult;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Durable three-phase sync of one tenant: essential, reference, validation.
 */
@WorkflowInterface
public interface TenantSyncWorkflow {

    /**
     * Always returns a result; only a request without tenantId or authToken fails the run
     * (non-retryable ValidationError).
     */
    @WorkflowMethod
    TenantSyncResult syncTenant(TenantSyncRequest request);
}

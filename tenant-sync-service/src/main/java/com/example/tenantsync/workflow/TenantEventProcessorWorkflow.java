package com.example.tenantsync.workflow;

import com.example.common.events.OrganizationAssignmentEvent;
import com.example.tenantsync.dto.TenantEventProcessorInput;
import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.SignalMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Long-lived per-tenant processor of organization assignment changes.
 * One instance per tenant, workflow id "org-assignment-{tenantId}".
 */
@WorkflowInterface
public interface TenantEventProcessorWorkflow {

    /**
     * Listens indefinitely; never completes under normal operation.
     */
    @WorkflowMethod
    void run(TenantEventProcessorInput input);

    /**
     * At-least-once delivery is expected; duplicates are dropped by idempotency key.
     */
    @SignalMethod
    void onAssignmentEvent(OrganizationAssignmentEvent event);

    @QueryMethod
    int ledgerSize();

    @QueryMethod
    int pendingEvents();
}

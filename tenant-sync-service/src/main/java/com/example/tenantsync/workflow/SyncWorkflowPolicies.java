package com.example.tenantsync.workflow;

import lombok.Builder;
import lombok.Value;

/**
 * Everything a workflow implementation needs besides its input.
 */
@Value
@Builder
public class SyncWorkflowPolicies {

    @Builder.Default
    ActivityRetryPolicy tenantSync = ActivityRetryPolicy.forTenantSync();

    @Builder.Default
    ActivityRetryPolicy assignmentHandlers = ActivityRetryPolicy.forAssignmentHandlers();

    @Builder.Default
    ActivityRetryPolicy deadLetterPublish = ActivityRetryPolicy.forDeadLetterPublish();

    @Builder.Default
    EventProcessorSettings eventProcessor = EventProcessorSettings.defaults();

    /**
     * Task queue for dead-letter child workflows; null means the parent's queue.
     */
    String taskQueue;

    public static SyncWorkflowPolicies defaults() {
        return SyncWorkflowPolicies.builder().build();
    }
}

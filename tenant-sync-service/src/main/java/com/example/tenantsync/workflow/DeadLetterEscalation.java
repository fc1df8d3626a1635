package com.example.tenantsync.workflow;

import com.example.tenantsync.activity.DeadLetterActivities;
import com.example.tenantsync.dto.DeadLetterRequest;
import com.example.tenantsync.dto.DeadLetterResult;
import io.temporal.failure.TemporalFailure;
import io.temporal.workflow.ChildWorkflowOptions;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

/**
 * Workflow-side escalation: run the dead letter handler as a child workflow, then publish
 * its entry. A failing escalation is logged and never fails the calling workflow.
 *
 * Must be created inside workflow code.
 */
class DeadLetterEscalation {

    private static final Logger log = Workflow.getLogger(DeadLetterEscalation.class);

    private final DeadLetterActivities deadLetterActivities;
    private final String taskQueue;

    DeadLetterEscalation(SyncWorkflowPolicies policies) {
        this.deadLetterActivities = Workflow.newActivityStub(
                DeadLetterActivities.class, policies.getDeadLetterPublish().toActivityOptions());
        this.taskQueue = policies.getTaskQueue();
    }

    void escalate(DeadLetterRequest request) {
        ChildWorkflowOptions.Builder options = ChildWorkflowOptions.newBuilder()
                .setWorkflowId("dead-letter-" + request.getWorkflowId() + "-" + Workflow.randomUUID());
        if (taskQueue != null) {
            options.setTaskQueue(taskQueue);
        }

        try {
            DeadLetterWorkflow handler = Workflow.newChildWorkflowStub(DeadLetterWorkflow.class, options.build());
            DeadLetterResult result = handler.handle(request);
            deadLetterActivities.publishDeadLetter(result.getDlqEntry());
            log.warn("⚠️ Escalated to dead letter: workflowId={}, tenantId={}",
                    request.getWorkflowId(), request.getTenantId());
        } catch (TemporalFailure e) {
            log.error("❌ Dead letter escalation failed: workflowId={}, tenantId={}, error={}",
                    request.getWorkflowId(), request.getTenantId(), e.getMessage());
        }
    }
}

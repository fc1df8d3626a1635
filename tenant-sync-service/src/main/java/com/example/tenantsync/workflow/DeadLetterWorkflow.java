package com.example.tenantsync.workflow;

import com.example.tenantsync.dto.DeadLetterRequest;
import com.example.tenantsync.dto.DeadLetterResult;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Shapes a dead-letter entry for a run that exhausted its retries.
 */
@WorkflowInterface
public interface DeadLetterWorkflow {

    @WorkflowMethod
    DeadLetterResult handle(DeadLetterRequest request);
}

package com.example.tenantsync.workflow;

import com.example.tenantsync.dto.DeadLetterEntry;
import com.example.tenantsync.dto.DeadLetterRequest;
import com.example.tenantsync.dto.DeadLetterResult;
import io.temporal.workflow.Workflow;
import io.temporal.workflow.WorkflowInfo;
import org.slf4j.Logger;

import java.time.Instant;

public class DeadLetterWorkflowImpl implements DeadLetterWorkflow {

    private static final Logger log = Workflow.getLogger(DeadLetterWorkflowImpl.class);

    @Override
    public DeadLetterResult handle(DeadLetterRequest request) {
        WorkflowInfo info = Workflow.getInfo();
        String timestamp = Instant.ofEpochMilli(Workflow.currentTimeMillis()).toString();

        DeadLetterEntry entry = DeadLetterEntryFactory.create(request, timestamp, info.getWorkflowId(), info.getRunId());

        log.error("❌ Dead letter: workflowId={}, workflowType={}, tenantId={}, errorType={}, error={}",
                entry.getWorkflowId(), entry.getWorkflowType(), entry.getTenantId(),
                entry.getError().getType(), entry.getError().getMessage());

        return DeadLetterResult.builder()
                .success(true)
                .dlqEntry(entry)
                .message("Dead letter entry created for workflow " + entry.getWorkflowId())
                .build();
    }
}

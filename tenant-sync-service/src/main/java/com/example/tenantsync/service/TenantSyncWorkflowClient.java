package com.example.tenantsync.service;

import com.example.common.events.OrganizationAssignmentEvent;
import com.example.tenantsync.dto.DeadLetterRequest;
import com.example.tenantsync.dto.DeadLetterResult;
import com.example.tenantsync.dto.TenantEventProcessorInput;
import com.example.tenantsync.dto.TenantSyncRequest;
import com.example.tenantsync.dto.TenantSyncResult;
import com.example.tenantsync.dto.response.SyncExecutionResponse;
import com.example.tenantsync.exception.BadRequestException;
import com.example.tenantsync.exception.ConflictException;
import com.example.tenantsync.exception.ServiceUnavailableException;
import com.example.tenantsync.workflow.DeadLetterWorkflow;
import com.example.tenantsync.workflow.SyncErrorTypes;
import com.example.tenantsync.workflow.SyncWorkflowPolicies;
import com.example.tenantsync.workflow.TenantEventProcessorWorkflow;
import com.example.tenantsync.workflow.TenantSyncWorkflow;
import io.grpc.StatusRuntimeException;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.client.BatchRequest;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowException;
import io.temporal.client.WorkflowExecutionAlreadyStarted;
import io.temporal.client.WorkflowFailedException;
import io.temporal.client.WorkflowOptions;
import io.temporal.failure.ApplicationFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Entry point for starting and signalling the sync workflows.
 *
 * Temporal client errors are translated into the service's exception hierarchy so the
 * REST layer can map them to HTTP statuses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantSyncWorkflowClient {

    static final String TENANT_SYNC_PREFIX = "tenant-sync-";
    static final String EVENT_PROCESSOR_PREFIX = "org-assignment-";
    static final String DEAD_LETTER_PREFIX = "dead-letter-";

    private final WorkflowClient workflowClient;
    private final SyncWorkflowPolicies policies;
    private final Clock clock;

    /**
     * Run a tenant sync and wait for its result.
     */
    public TenantSyncResult runTenantSync(TenantSyncRequest request) {
        TenantSyncWorkflow workflow = newTenantSyncStub(request.getTenantId());
        log.info("Running tenant sync: tenantId={}, triggerSource={}", request.getTenantId(), request.getTriggerSource());
        return call(() -> workflow.syncTenant(request));
    }

    /**
     * Start a tenant sync without waiting.
     */
    public SyncExecutionResponse startTenantSync(TenantSyncRequest request) {
        TenantSyncWorkflow workflow = newTenantSyncStub(request.getTenantId());
        WorkflowExecution execution = call(() -> WorkflowClient.start(workflow::syncTenant, request));
        log.info("Started tenant sync: tenantId={}, workflowId={}", request.getTenantId(), execution.getWorkflowId());

        return SyncExecutionResponse.builder()
                .tenantId(request.getTenantId())
                .workflowId(execution.getWorkflowId())
                .runId(execution.getRunId())
                .message("Tenant sync started")
                .build();
    }

    /**
     * Deliver an assignment event to the tenant's processor, starting the processor if it
     * is not running.
     */
    public SyncExecutionResponse sendAssignmentEvent(String tenantId, OrganizationAssignmentEvent event) {
        if (event == null || event.getType() == null) {
            throw BadRequestException.invalidEventType(null);
        }

        TenantEventProcessorWorkflow processor = workflowClient.newWorkflowStub(
                TenantEventProcessorWorkflow.class,
                WorkflowOptions.newBuilder()
                        .setWorkflowId(EVENT_PROCESSOR_PREFIX + tenantId)
                        .setTaskQueue(policies.getTaskQueue())
                        .build());

        BatchRequest signalWithStart = workflowClient.newSignalWithStartRequest();
        signalWithStart.add(processor::run, TenantEventProcessorInput.fresh(tenantId));
        signalWithStart.add(processor::onAssignmentEvent, event);

        WorkflowExecution execution = call(() -> workflowClient.signalWithStart(signalWithStart));
        log.info("Assignment event sent: tenantId={}, type={}, assignmentId={}, workflowId={}",
                tenantId, event.getType().wireName(), event.getAssignmentId(), execution.getWorkflowId());

        return SyncExecutionResponse.builder()
                .tenantId(tenantId)
                .workflowId(execution.getWorkflowId())
                .runId(execution.getRunId())
                .message("Assignment event accepted")
                .build();
    }

    /**
     * Run the dead letter handler for a failure reported outside a workflow.
     */
    public DeadLetterResult handleDeadLetter(DeadLetterRequest request) {
        DeadLetterWorkflow workflow = workflowClient.newWorkflowStub(
                DeadLetterWorkflow.class,
                WorkflowOptions.newBuilder()
                        .setWorkflowId(DEAD_LETTER_PREFIX + request.getWorkflowId() + "-" + clock.millis())
                        .setTaskQueue(policies.getTaskQueue())
                        .build());
        return call(() -> workflow.handle(request));
    }

    private TenantSyncWorkflow newTenantSyncStub(String tenantId) {
        return workflowClient.newWorkflowStub(
                TenantSyncWorkflow.class,
                WorkflowOptions.newBuilder()
                        .setWorkflowId(TENANT_SYNC_PREFIX + tenantId + "-" + clock.millis())
                        .setTaskQueue(policies.getTaskQueue())
                        .build());
    }

    private <T> T call(Supplier<T> temporalCall) {
        try {
            return temporalCall.get();
        } catch (WorkflowExecutionAlreadyStarted e) {
            throw ConflictException.syncAlreadyRunning(e.getExecution().getWorkflowId());
        } catch (WorkflowFailedException e) {
            if (e.getCause() instanceof ApplicationFailure failure
                    && SyncErrorTypes.VALIDATION_ERROR.equals(failure.getType())) {
                throw BadRequestException.invalidSyncRequest(failure.getOriginalMessage());
            }
            log.error("❌ Workflow failed: {}", e.getMessage());
            throw ServiceUnavailableException.workflowEngineUnavailable(e.getMessage());
        } catch (WorkflowException | StatusRuntimeException e) {
            log.error("❌ Workflow engine call failed: {}", e.getMessage());
            throw ServiceUnavailableException.workflowEngineUnavailable(e.getMessage());
        }
    }
}

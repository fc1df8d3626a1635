package com.example.tenantsync.workflow;

import com.example.common.events.OrganizationAssignmentEvent;
import com.example.tenantsync.activity.OrganizationAssignmentActivities;
import com.example.tenantsync.dto.AssignmentHandlerInput;
import com.example.tenantsync.dto.DeadLetterRequest;
import com.example.tenantsync.dto.ErrorInfo;
import com.example.tenantsync.dto.TenantEventProcessorInput;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.workflow.Workflow;
import io.temporal.workflow.WorkflowInfo;
import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-tenant event processor.
 *
 * Signals only enqueue; the main loop dispatches one event at a time, so handlers for a
 * tenant never overlap. A signal whose key is already processed or already queued is
 * dropped on arrival. An event's key enters the ledger before its handler runs and stays
 * there even if the handler fails, so a redelivered copy is never processed twice.
 */
public class TenantEventProcessorWorkflowImpl implements TenantEventProcessorWorkflow {

    private static final Logger log = Workflow.getLogger(TenantEventProcessorWorkflowImpl.class);

    private final SyncWorkflowPolicies policies;
    private final IdempotencyLedger ledger;
    private final Deque<OrganizationAssignmentEvent> pending = new ArrayDeque<>();
    private final Set<String> pendingKeys = new HashSet<>();

    private String tenantId;
    private int dispatchedInRun;

    public TenantEventProcessorWorkflowImpl() {
        this(SyncWorkflowPolicies.defaults());
    }

    public TenantEventProcessorWorkflowImpl(SyncWorkflowPolicies policies) {
        this.policies = policies;
        this.ledger = new IdempotencyLedger(policies.getEventProcessor().getLedgerCapacity());
    }

    @Override
    public void run(TenantEventProcessorInput input) {
        if (input == null || input.getTenantId() == null || input.getTenantId().isBlank()) {
            throw ApplicationFailure.newNonRetryableFailure("tenantId is required", SyncErrorTypes.VALIDATION_ERROR);
        }
        tenantId = input.getTenantId();
        ledger.restore(input.getProcessedKeys());
        requeue(input.getPendingEvents());

        OrganizationAssignmentActivities handlers = Workflow.newActivityStub(
                OrganizationAssignmentActivities.class, policies.getAssignmentHandlers().toActivityOptions());
        DeadLetterEscalation escalation = new DeadLetterEscalation(policies);
        int continueAsNewAfter = policies.getEventProcessor().getContinueAsNewAfter();

        log.info("Event processor listening: tenantId={}, ledgerSize={}, pending={}",
                tenantId, ledger.size(), pending.size());

        while (true) {
            Workflow.await(() -> !pending.isEmpty());
            OrganizationAssignmentEvent event = pending.poll();

            String key = event.idempotencyKey();
            pendingKeys.remove(key);
            if (!ledger.add(key)) {
                log.info("Duplicate assignment event skipped: tenantId={}, key={}", tenantId, key);
                continue;
            }

            dispatch(handlers, escalation, event);
            dispatchedInRun++;

            if (dispatchedInRun >= continueAsNewAfter) {
                log.info("Continuing as new: tenantId={}, ledgerSize={}, pending={}",
                        tenantId, ledger.size(), pending.size());
                Workflow.continueAsNew(TenantEventProcessorInput.builder()
                        .tenantId(tenantId)
                        .processedKeys(ledger.snapshot())
                        .pendingEvents(new ArrayList<>(pending))
                        .build());
            }
        }
    }

    @Override
    public void onAssignmentEvent(OrganizationAssignmentEvent event) {
        if (event == null || event.getType() == null) {
            log.warn("⚠️ Dropping assignment event without type: tenantId={}", tenantId);
            return;
        }

        String key = event.idempotencyKey();
        if (!enqueue(event)) {
            log.info("Duplicate assignment event dropped: tenantId={}, key={}", tenantId, key);
            return;
        }
        log.debug("Assignment event queued: tenantId={}, key={}, pending={}", tenantId, key, pending.size());
    }

    @Override
    public int ledgerSize() {
        return ledger.size();
    }

    @Override
    public int pendingEvents() {
        return pending.size();
    }

    private boolean enqueue(OrganizationAssignmentEvent event) {
        String key = event.idempotencyKey();
        if (ledger.contains(key) || !pendingKeys.add(key)) {
            return false;
        }
        pending.add(event);
        return true;
    }

    /**
     * Carried events go ahead of signals that arrived before the run started.
     */
    private void requeue(List<OrganizationAssignmentEvent> carried) {
        List<OrganizationAssignmentEvent> early = new ArrayList<>(pending);
        pending.clear();
        pendingKeys.clear();
        if (carried != null) {
            carried.forEach(this::enqueue);
        }
        early.forEach(this::enqueue);
    }

    private void dispatch(OrganizationAssignmentActivities handlers,
                          DeadLetterEscalation escalation,
                          OrganizationAssignmentEvent event) {
        AssignmentHandlerInput input = AssignmentHandlerInput.of(tenantId, event);
        try {
            switch (event.getType()) {
                case CREATED -> handlers.handleOrganizationAssignmentCreated(input);
                case DELETED -> handlers.handleOrganizationAssignmentDeleted(input);
                case ACTIVATED -> handlers.handleOrganizationAssignmentActivated(input);
                case DEACTIVATED -> handlers.handleOrganizationAssignmentDeactivated(input);
            }
            log.info("Processed assignment event: tenantId={}, type={}, assignmentId={}",
                    tenantId, event.getType().wireName(), event.getAssignmentId());
        } catch (ActivityFailure e) {
            ErrorInfo error = WorkflowFailures.errorInfoOf(e);
            log.error("❌ Assignment handler failed: tenantId={}, type={}, assignmentId={}, error={}",
                    tenantId, event.getType().wireName(), event.getAssignmentId(), error.getMessage());
            escalation.escalate(deadLetterRequest(event, error));
        }
    }

    private DeadLetterRequest deadLetterRequest(OrganizationAssignmentEvent event, ErrorInfo error) {
        WorkflowInfo info = Workflow.getInfo();

        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("type", event.getType().wireName());
        eventData.put("eventId", event.getEventId());
        eventData.put("assignmentId", event.getAssignmentId());
        eventData.put("userId", event.getUserId());
        eventData.put("organizationId", event.getOrganizationId());
        eventData.put("attributes", event.getAttributes());

        return DeadLetterRequest.builder()
                .workflowId(info.getWorkflowId())
                .runId(info.getRunId())
                .workflowType(info.getWorkflowType())
                .tenantId(tenantId)
                .error(error)
                .eventData(eventData)
                .build();
    }
}

package com.example.tenantsync.workflow;

import com.example.tenantsync.activity.TenantSyncActivities;
import com.example.tenantsync.dto.DeadLetterRequest;
import com.example.tenantsync.dto.ErrorInfo;
import com.example.tenantsync.dto.PhaseActivityInput;
import com.example.tenantsync.dto.PhaseActivityResult;
import com.example.tenantsync.dto.PhaseReport;
import com.example.tenantsync.dto.SyncOptions;
import com.example.tenantsync.dto.TenantSyncRequest;
import com.example.tenantsync.dto.TenantSyncResult;
import com.example.tenantsync.dto.ValidationActivityResult;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.workflow.Workflow;
import io.temporal.workflow.WorkflowInfo;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tenant sync orchestrator.
 *
 * Essential data gates everything: if it fails or another run holds the tenant, the run
 * stops with success=false. Reference and validation failures are reported in the phase
 * entries but leave success=true.
 *
 * An activity that exhausts its retries is escalated to the dead letter handler, unless
 * its failure is permanent input rejection (ValidationError, and NotFoundError outside
 * the essential phase).
 */
public class TenantSyncWorkflowImpl implements TenantSyncWorkflow {

    private static final Logger log = Workflow.getLogger(TenantSyncWorkflowImpl.class);

    static final String PHASE_ESSENTIAL = "essential";
    static final String PHASE_REFERENCE = "reference";
    static final String PHASE_VALIDATION = "validation";
    static final String SKIP_REFERENCE_REASON = "skip_reference_data";

    private final SyncWorkflowPolicies policies;

    public TenantSyncWorkflowImpl() {
        this(SyncWorkflowPolicies.defaults());
    }

    public TenantSyncWorkflowImpl(SyncWorkflowPolicies policies) {
        this.policies = policies;
    }

    @Override
    public TenantSyncResult syncTenant(TenantSyncRequest request) {
        validate(request);

        WorkflowInfo info = Workflow.getInfo();
        SyncOptions options = request.getOptions() != null ? request.getOptions() : SyncOptions.defaults();
        TenantSyncActivities activities = Workflow.newActivityStub(
                TenantSyncActivities.class, policies.getTenantSync().toActivityOptions());

        TenantSyncResult result = TenantSyncResult.builder()
                .tenantId(request.getTenantId())
                .workflowId(info.getWorkflowId())
                .runId(info.getRunId())
                .startTime(Workflow.currentTimeMillis())
                .build();

        PhaseActivityInput phaseInput = PhaseActivityInput.builder()
                .tenantId(request.getTenantId())
                .authToken(request.getAuthToken())
                .forceSync(options.isForceSync())
                .ownerId(info.getWorkflowId() + ":" + info.getRunId())
                .triggerSource(request.getTriggerSource() != null ? request.getTriggerSource() : "workflow")
                .build();

        log.info("Starting tenant sync: tenantId={}, forceSync={}, skipReferenceData={}",
                request.getTenantId(), options.isForceSync(), options.isSkipReferenceData());

        // Phase 1: essential data
        long phaseStart = Workflow.currentTimeMillis();
        PhaseActivityResult essential;
        try {
            essential = activities.syncEssentialData(phaseInput);
        } catch (ActivityFailure e) {
            ErrorInfo error = WorkflowFailures.errorInfoOf(e);
            log.error("❌ Essential data sync failed: tenantId={}, type={}, error={}",
                    request.getTenantId(), error.getType(), error.getMessage());
            result.getPhases().setEssential(failedPhase(error, phaseStart));
            if (!WorkflowFailures.isType(e, SyncErrorTypes.VALIDATION_ERROR)) {
                new DeadLetterEscalation(policies).escalate(
                        deadLetterRequest(info, request, options, inPhase(error, PHASE_ESSENTIAL)));
            }
            return finish(result, false, inPhase(error, PHASE_ESSENTIAL));
        }

        result.getPhases().setEssential(report(essential, phaseStart));

        if (essential.isSkippedAs(PhaseActivityResult.SYNC_IN_PROGRESS)) {
            log.warn("⚠️ Tenant sync skipped, another run holds the lock: tenantId={}", request.getTenantId());
            ErrorInfo error = ErrorInfo.builder()
                    .message("Sync already in progress for tenant " + request.getTenantId())
                    .type("SyncInProgress")
                    .phase(PHASE_ESSENTIAL)
                    .build();
            return finish(result, false, error);
        }
        if (!essential.isSuccess()) {
            ErrorInfo error = essential.getError() != null
                    ? essential.getError()
                    : ErrorInfo.of("Essential data sync failed", "SyncError");
            return finish(result, false, inPhase(error, PHASE_ESSENTIAL));
        }

        // Phase 2: reference data
        if (options.isSkipReferenceData()) {
            result.getPhases().setReference(PhaseReport.builder()
                    .success(true)
                    .skipped(true)
                    .reason(SKIP_REFERENCE_REASON)
                    .build());
        } else {
            phaseStart = Workflow.currentTimeMillis();
            try {
                PhaseActivityResult reference = activities.syncReferenceData(phaseInput);
                if (!reference.isSuccess()) {
                    log.warn("⚠️ Reference data sync incomplete: tenantId={}, error={}", request.getTenantId(),
                            reference.getError() != null ? reference.getError().getMessage() : null);
                }
                result.getPhases().setReference(report(reference, phaseStart));
            } catch (ActivityFailure e) {
                ErrorInfo error = WorkflowFailures.errorInfoOf(e);
                log.warn("⚠️ Reference data sync failed (non-critical): tenantId={}, error={}",
                        request.getTenantId(), error.getMessage());
                result.getPhases().setReference(failedPhase(error, phaseStart));
                escalateNonCritical(info, request, options, e, inPhase(error, PHASE_REFERENCE));
            }
        }

        // Phase 3: validation
        phaseStart = Workflow.currentTimeMillis();
        try {
            ValidationActivityResult validation = activities.validateSyncCompletion(request.getTenantId());
            if (!validation.isValid()) {
                log.warn("⚠️ Sync validation reported issues: tenantId={}, issues={}",
                        request.getTenantId(), validation.getIssues());
            }
            result.getPhases().setValidation(PhaseReport.builder()
                    .success(validation.isSuccess())
                    .valid(validation.isValid())
                    .issues(validation.getIssues())
                    .error(validation.getError())
                    .durationMs(Workflow.currentTimeMillis() - phaseStart)
                    .build());
        } catch (ActivityFailure e) {
            ErrorInfo error = WorkflowFailures.errorInfoOf(e);
            log.warn("⚠️ Sync validation failed (non-critical): tenantId={}, error={}",
                    request.getTenantId(), error.getMessage());
            result.getPhases().setValidation(failedPhase(error, phaseStart));
            escalateNonCritical(info, request, options, e, inPhase(error, PHASE_VALIDATION));
        }

        return finish(result, true, null);
    }

    private void escalateNonCritical(WorkflowInfo info, TenantSyncRequest request, SyncOptions options,
                                     ActivityFailure failure, ErrorInfo error) {
        if (WorkflowFailures.isType(failure, SyncErrorTypes.VALIDATION_ERROR)
                || WorkflowFailures.isType(failure, SyncErrorTypes.NOT_FOUND_ERROR)) {
            return;
        }
        new DeadLetterEscalation(policies).escalate(deadLetterRequest(info, request, options, error));
    }

    private static void validate(TenantSyncRequest request) {
        if (request == null || request.getTenantId() == null || request.getTenantId().isBlank()) {
            throw ApplicationFailure.newNonRetryableFailure("tenantId is required", SyncErrorTypes.VALIDATION_ERROR);
        }
        if (request.getAuthToken() == null || request.getAuthToken().isBlank()) {
            throw ApplicationFailure.newNonRetryableFailure(
                    "authToken is required for tenant " + request.getTenantId(), SyncErrorTypes.VALIDATION_ERROR);
        }
    }

    private static TenantSyncResult finish(TenantSyncResult result, boolean success, ErrorInfo error) {
        long endTime = Workflow.currentTimeMillis();
        result.setEndTime(endTime);
        result.setDurationMs(endTime - result.getStartTime());
        result.setSuccess(success);
        result.setError(error);
        if (success) {
            log.info("✅ Tenant sync finished: tenantId={}, duration={}ms", result.getTenantId(), result.getDurationMs());
        } else {
            log.warn("⚠️ Tenant sync unsuccessful: tenantId={}, duration={}ms, error={}",
                    result.getTenantId(), result.getDurationMs(), error != null ? error.getMessage() : null);
        }
        return result;
    }

    private static PhaseReport report(PhaseActivityResult phase, long phaseStart) {
        return PhaseReport.builder()
                .success(phase.isSuccess())
                .skipped(phase.isSkipped())
                .reason(phase.getReason())
                .stats(phase.getStats())
                .error(phase.getError())
                .durationMs(Workflow.currentTimeMillis() - phaseStart)
                .build();
    }

    private static PhaseReport failedPhase(ErrorInfo error, long phaseStart) {
        return PhaseReport.builder()
                .success(false)
                .error(error)
                .durationMs(Workflow.currentTimeMillis() - phaseStart)
                .build();
    }

    private static ErrorInfo inPhase(ErrorInfo error, String phase) {
        return ErrorInfo.builder()
                .message(error.getMessage())
                .type(error.getType())
                .stack(error.getStack())
                .phase(phase)
                .build();
    }

    private static DeadLetterRequest deadLetterRequest(WorkflowInfo info, TenantSyncRequest request,
                                                       SyncOptions options, ErrorInfo error) {
        // no bearer token in dead letters
        Map<String, Object> eventData = new LinkedHashMap<>();
        eventData.put("tenantId", request.getTenantId());
        eventData.put("forceSync", options.isForceSync());
        eventData.put("skipReferenceData", options.isSkipReferenceData());
        eventData.put("triggerSource", request.getTriggerSource());

        return DeadLetterRequest.builder()
                .workflowId(info.getWorkflowId())
                .runId(info.getRunId())
                .workflowType(info.getWorkflowType())
                .tenantId(request.getTenantId())
                .error(error)
                .eventData(eventData)
                .build();
    }
}

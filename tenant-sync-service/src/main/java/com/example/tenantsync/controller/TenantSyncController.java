package com.example.tenantsync.controller;

import com.example.common.events.OrganizationAssignmentEvent;
import com.example.common.events.OrganizationAssignmentEventType;
import com.example.tenantsync.dto.SyncOptions;
import com.example.tenantsync.dto.TenantSyncRequest;
import com.example.tenantsync.dto.TenantSyncResult;
import com.example.tenantsync.dto.TenantSyncStatusView;
import com.example.tenantsync.dto.request.AssignmentEventRequest;
import com.example.tenantsync.dto.request.SyncTriggerRequest;
import com.example.tenantsync.dto.response.SyncExecutionResponse;
import com.example.tenantsync.exception.BadRequestException;
import com.example.tenantsync.exception.ResourceNotFoundException;
import com.example.tenantsync.metrics.SyncMetrics;
import com.example.tenantsync.service.SyncStatusStore;
import com.example.tenantsync.service.TenantSyncLockManager;
import com.example.tenantsync.service.TenantSyncWorkflowClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator and integration endpoints for tenant sync.
 *
 * The bearer token in the Authorization header is forwarded to the wrapper API by the
 * sync activities; this service does not validate it.
 */
@RestController
@RequestMapping("/api/sync")
@Tag(name = "Tenant Sync", description = "Trigger and inspect tenant data sync")
@Slf4j
public class TenantSyncController {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String MDC_TENANT_ID = "tenantId";

    private final TenantSyncWorkflowClient workflowClient;
    private final SyncStatusStore statusStore;
    private final TenantSyncLockManager lockManager;
    private final SyncMetrics syncMetrics;
    private final Duration stuckThreshold;

    public TenantSyncController(
            TenantSyncWorkflowClient workflowClient,
            SyncStatusStore statusStore,
            TenantSyncLockManager lockManager,
            SyncMetrics syncMetrics,
            @Value("${tenant-sync.cleanup.stuck-threshold:10m}") Duration stuckThreshold) {
        this.workflowClient = workflowClient;
        this.statusStore = statusStore;
        this.lockManager = lockManager;
        this.syncMetrics = syncMetrics;
        this.stuckThreshold = stuckThreshold;
    }

    // ========================================
    // SYNC EXECUTION
    // ========================================

    @Operation(
            summary = "Trigger tenant sync",
            description = "Start a sync workflow for the tenant and return immediately.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Sync started"),
                    @ApiResponse(responseCode = "400", description = "Missing bearer token"),
                    @ApiResponse(responseCode = "503", description = "Workflow engine unavailable")
            }
    )
    @PostMapping("/tenants/{tenantId}/trigger")
    public ResponseEntity<SyncExecutionResponse> triggerSync(
            @Parameter(description = "Tenant ID") @PathVariable("tenantId") String tenantId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) SyncTriggerRequest body) {
        MDC.put(MDC_TENANT_ID, tenantId);
        try {
            SyncOptions options = body != null
                    ? new SyncOptions(body.isForceSync(), body.isSkipReferenceData())
                    : SyncOptions.defaults();
            SyncExecutionResponse response = workflowClient.startTenantSync(
                    syncRequest(tenantId, authorization, options, "api"));
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        } finally {
            MDC.remove(MDC_TENANT_ID);
        }
    }

    @Operation(
            summary = "Run tenant sync and wait",
            description = "Run a sync workflow to completion and return its phase results.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Sync finished, see success flag"),
                    @ApiResponse(responseCode = "400", description = "Missing bearer token"),
                    @ApiResponse(responseCode = "503", description = "Workflow engine unavailable")
            }
    )
    @PostMapping("/tenants/{tenantId}/run")
    public ResponseEntity<TenantSyncResult> runSync(
            @Parameter(description = "Tenant ID") @PathVariable("tenantId") String tenantId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) SyncTriggerRequest body) {
        MDC.put(MDC_TENANT_ID, tenantId);
        try {
            SyncOptions options = body != null
                    ? new SyncOptions(body.isForceSync(), body.isSkipReferenceData())
                    : SyncOptions.defaults();
            return ResponseEntity.ok(workflowClient.runTenantSync(
                    syncRequest(tenantId, authorization, options, "manual")));
        } finally {
            MDC.remove(MDC_TENANT_ID);
        }
    }

    @Operation(
            summary = "Force tenant sync",
            description = "Start a sync that ignores completed state and takes over any held lock.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Forced sync started"),
                    @ApiResponse(responseCode = "400", description = "Missing bearer token")
            }
    )
    @PostMapping("/tenants/{tenantId}/force")
    public ResponseEntity<SyncExecutionResponse> forceSync(
            @Parameter(description = "Tenant ID") @PathVariable("tenantId") String tenantId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        MDC.put(MDC_TENANT_ID, tenantId);
        try {
            log.warn("⚠️ Forced sync requested: tenantId={}", tenantId);
            SyncExecutionResponse response = workflowClient.startTenantSync(
                    syncRequest(tenantId, authorization, new SyncOptions(true, false), "manual"));
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        } finally {
            MDC.remove(MDC_TENANT_ID);
        }
    }

    @Operation(
            summary = "Submit organization assignment event",
            description = "Signal the tenant's event processor, starting it if needed.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Event accepted"),
                    @ApiResponse(responseCode = "400", description = "Unknown event type or missing fields")
            }
    )
    @PostMapping("/tenants/{tenantId}/assignment-events")
    public ResponseEntity<SyncExecutionResponse> submitAssignmentEvent(
            @Parameter(description = "Tenant ID") @PathVariable("tenantId") String tenantId,
            @Valid @RequestBody AssignmentEventRequest request) {
        OrganizationAssignmentEventType type;
        try {
            type = OrganizationAssignmentEventType.fromWireName(request.getType());
        } catch (IllegalArgumentException e) {
            throw BadRequestException.invalidEventType(request.getType());
        }

        OrganizationAssignmentEvent event = OrganizationAssignmentEvent.builder()
                .type(type)
                .assignmentId(request.getAssignmentId())
                .userId(request.getUserId())
                .organizationId(request.getOrganizationId())
                .eventId(request.getEventId())
                .attributes(request.getAttributes() != null ? request.getAttributes() : new LinkedHashMap<>())
                .eventTimestamp(Instant.now())
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(workflowClient.sendAssignmentEvent(tenantId, event));
    }

    // ========================================
    // STATUS & MAINTENANCE
    // ========================================

    @Operation(summary = "Get tenant sync status")
    @GetMapping("/tenants/{tenantId}/status")
    public ResponseEntity<TenantSyncStatusView> getStatus(
            @Parameter(description = "Tenant ID") @PathVariable("tenantId") String tenantId) {
        return statusStore.get(tenantId)
                .map(TenantSyncStatusView::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ResourceNotFoundException.syncStatusNotFound(tenantId));
    }

    @Operation(
            summary = "Release tenant sync lock",
            description = "Unconditionally release the tenant's sync lock. Use when a worker died holding it."
    )
    @DeleteMapping("/tenants/{tenantId}/lock")
    public ResponseEntity<Map<String, Object>> releaseLock(
            @Parameter(description = "Tenant ID") @PathVariable("tenantId") String tenantId) {
        if (statusStore.get(tenantId).isEmpty()) {
            throw ResourceNotFoundException.syncStatusNotFound(tenantId);
        }
        lockManager.releaseLock(tenantId);
        log.warn("⚠️ Sync lock released manually: tenantId={}", tenantId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenantId);
        body.put("message", "Lock released");
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Check whether a tenant needs sync")
    @GetMapping("/needs-sync/{tenantId}")
    public ResponseEntity<Map<String, Object>> needsSync(
            @Parameter(description = "Tenant ID") @PathVariable("tenantId") String tenantId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenantId);
        body.put("needsSync", statusStore.needsSync(tenantId));
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Fail syncs stuck in progress after their lock expired")
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanupStuckSyncs() {
        int cleaned = statusStore.cleanupStuckSyncs(stuckThreshold);
        syncMetrics.recordStuckSyncsCleaned(cleaned);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cleaned", cleaned);
        body.put("threshold", stuckThreshold.toString());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Tenant count per sync state")
    @GetMapping("/statistics")
    public ResponseEntity<Map<String, Long>> statistics() {
        return ResponseEntity.ok(statusStore.statistics());
    }

    private static TenantSyncRequest syncRequest(String tenantId, String authorization,
                                                 SyncOptions options, String triggerSource) {
        return TenantSyncRequest.builder()
                .tenantId(tenantId)
                .authToken(bearerToken(authorization))
                .options(options)
                .triggerSource(triggerSource)
                .build();
    }

    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw BadRequestException.missingAuthToken();
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw BadRequestException.missingAuthToken();
        }
        return token;
    }
}

package com.example.tenantsync.activity;

import com.example.common.events.OrganizationAssignmentEventType;
import com.example.tenantsync.dto.AssignmentHandlerInput;
import com.example.tenantsync.entity.SyncCollection;
import com.example.tenantsync.entity.SyncedRecord;
import com.example.tenantsync.metrics.SyncMetrics;
import com.example.tenantsync.repository.SyncedRecordRepository;
import com.example.tenantsync.workflow.SyncErrorTypes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.temporal.failure.ApplicationFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies organization assignment changes to the tenant's local employeeAssignments records.
 *
 * Every handler is idempotent: created/activated/deactivated upsert the record,
 * deleted removes it and tolerates an already-absent record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrganizationAssignmentActivitiesImpl implements OrganizationAssignmentActivities {

    private static final SyncCollection COLLECTION = SyncCollection.EMPLOYEE_ASSIGNMENTS;

    private final SyncedRecordRepository syncedRecordRepository;
    private final ObjectMapper objectMapper;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    @Override
    public void handleOrganizationAssignmentCreated(AssignmentHandlerInput input) {
        handle(OrganizationAssignmentEventType.CREATED, input, () -> {
            Map<String, Object> payload = new LinkedHashMap<>(attributesOf(input));
            payload.put("assignmentId", input.getAssignmentId());
            payload.put("userId", input.getUserId());
            payload.put("organizationId", input.getOrganizationId());
            payload.putIfAbsent("isActive", true);
            store(input, payload);
            log.info("Organization assignment created: assignmentId={}, userId={}, organizationId={}",
                    input.getAssignmentId(), input.getUserId(), input.getOrganizationId());
        });
    }

    @Override
    public void handleOrganizationAssignmentDeleted(AssignmentHandlerInput input) {
        handle(OrganizationAssignmentEventType.DELETED, input, () -> {
            int deleted = syncedRecordRepository.deleteRecord(input.getTenantId(), COLLECTION, input.getAssignmentId());
            if (deleted == 0) {
                log.info("Organization assignment already absent: assignmentId={}", input.getAssignmentId());
            } else {
                log.info("Organization assignment deleted: assignmentId={}", input.getAssignmentId());
            }
        });
    }

    @Override
    public void handleOrganizationAssignmentActivated(AssignmentHandlerInput input) {
        handle(OrganizationAssignmentEventType.ACTIVATED, input, () -> setActive(input, true));
    }

    @Override
    public void handleOrganizationAssignmentDeactivated(AssignmentHandlerInput input) {
        handle(OrganizationAssignmentEventType.DEACTIVATED, input, () -> setActive(input, false));
    }

    private void handle(OrganizationAssignmentEventType type, AssignmentHandlerInput input, Runnable action) {
        validate(input);
        MDC.put("tenantId", input.getTenantId());
        try {
            action.run();
            syncMetrics.recordAssignmentEvent(type.wireName(), true);
        } catch (RuntimeException e) {
            syncMetrics.recordAssignmentEvent(type.wireName(), false);
            log.error("Organization assignment {} handler failed: tenantId={}, assignmentId={}, error={}",
                    type.wireName(), input.getTenantId(), input.getAssignmentId(), e.getMessage());
            throw e;
        } finally {
            MDC.remove("tenantId");
        }
    }

    private void setActive(AssignmentHandlerInput input, boolean active) {
        SyncedRecord existing = syncedRecordRepository
                .findByTenantIdAndCollectionAndExternalId(input.getTenantId(), COLLECTION, input.getAssignmentId())
                .orElseThrow(() -> ApplicationFailure.newNonRetryableFailure(
                        "Organization assignment " + input.getAssignmentId() + " not found for tenant "
                                + input.getTenantId(),
                        SyncErrorTypes.NOT_FOUND_ERROR));

        Map<String, Object> payload = readPayload(existing.getPayload());
        payload.putAll(attributesOf(input));
        payload.put("isActive", active);
        if (input.getUserId() != null) {
            payload.put("userId", input.getUserId());
        }
        if (input.getOrganizationId() != null) {
            payload.put("organizationId", input.getOrganizationId());
        }
        store(input, payload);
        log.info("Organization assignment {}: assignmentId={}", active ? "activated" : "deactivated",
                input.getAssignmentId());
    }

    private void store(AssignmentHandlerInput input, Map<String, Object> payload) {
        syncedRecordRepository.upsertBatch(List.of(SyncedRecord.builder()
                .tenantId(input.getTenantId())
                .collection(COLLECTION)
                .externalId(input.getAssignmentId())
                .payload(writePayload(payload))
                .syncedAt(clock.instant())
                .build()));
    }

    private Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored assignment payload is not valid JSON: " + e.getMessage(), e);
        }
    }

    private String writePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize assignment payload: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> attributesOf(AssignmentHandlerInput input) {
        return input.getAttributes() != null ? input.getAttributes() : Map.of();
    }

    private static void validate(AssignmentHandlerInput input) {
        if (input == null || input.getTenantId() == null || input.getTenantId().isBlank()) {
            throw ApplicationFailure.newNonRetryableFailure("tenantId is required", SyncErrorTypes.VALIDATION_ERROR);
        }
        if (input.getAssignmentId() == null || input.getAssignmentId().isBlank()) {
            throw ApplicationFailure.newNonRetryableFailure("assignmentId is required", SyncErrorTypes.VALIDATION_ERROR);
        }
    }
}

package com.example.tenantsync.dto;

import com.example.common.events.OrganizationAssignmentEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Input of the organization assignment handler activities: the tenant plus the event payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentHandlerInput {

    private String tenantId;

    private String assignmentId;

    private String userId;

    private String organizationId;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    public static AssignmentHandlerInput of(String tenantId, OrganizationAssignmentEvent event) {
        return AssignmentHandlerInput.builder()
                .tenantId(tenantId)
                .assignmentId(event.getAssignmentId())
                .userId(event.getUserId())
                .organizationId(event.getOrganizationId())
                .attributes(event.getAttributes() != null ? new HashMap<>(event.getAttributes()) : new HashMap<>())
                .build();
    }
}

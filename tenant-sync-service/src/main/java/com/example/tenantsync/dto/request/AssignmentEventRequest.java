package com.example.tenantsync.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Organization assignment change pushed by the system of record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentEventRequest {

    /**
     * created, deleted, activated or deactivated.
     */
    @NotBlank(message = "type is required")
    private String type;

    @NotBlank(message = "assignmentId is required")
    private String assignmentId;

    private String userId;

    private String organizationId;

    private String eventId;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();
}

package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Permanent failure reported to the dead letter handler.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterRequest {

    private String workflowId;

    private String runId;

    private String workflowType;

    private ErrorInfo error;

    /**
     * The input or event being processed when the failure happened.
     */
    private Map<String, Object> eventData;

    private String tenantId;
}

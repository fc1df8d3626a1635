package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Structured failure record handed to the dead-letter publisher.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterEntry {

    private String workflowId;

    private String runId;

    private String workflowType;

    private String tenantId;

    private Map<String, Object> eventData;

    private ErrorInfo error;

    /**
     * ISO-8601.
     */
    private String timestamp;

    private String handlerWorkflowId;

    private String handlerRunId;
}

package com.example.tenantsync.workflow;

import com.example.tenantsync.dto.DeadLetterEntry;
import com.example.tenantsync.dto.DeadLetterRequest;
import com.example.tenantsync.dto.ErrorInfo;

import java.util.HashMap;

/**
 * Builds dead-letter entries, filling defaults for whatever the failing workflow left out.
 */
public final class DeadLetterEntryFactory {

    static final String UNKNOWN = "unknown";
    static final String UNKNOWN_ERROR = "Unknown error";

    private DeadLetterEntryFactory() {
    }

    public static DeadLetterEntry create(DeadLetterRequest request,
                                         String timestamp,
                                         String handlerWorkflowId,
                                         String handlerRunId) {
        DeadLetterRequest source = request != null ? request : new DeadLetterRequest();
        ErrorInfo error = source.getError();

        return DeadLetterEntry.builder()
                .workflowId(orUnknown(source.getWorkflowId()))
                .runId(orUnknown(source.getRunId()))
                .workflowType(orUnknown(source.getWorkflowType()))
                .tenantId(orUnknown(source.getTenantId()))
                .eventData(source.getEventData() != null ? new HashMap<>(source.getEventData()) : new HashMap<>())
                .error(ErrorInfo.builder()
                        .message(error != null && error.getMessage() != null ? error.getMessage() : UNKNOWN_ERROR)
                        .type(error != null && error.getType() != null ? error.getType() : UNKNOWN)
                        .stack(error != null ? error.getStack() : null)
                        .phase(error != null ? error.getPhase() : null)
                        .build())
                .timestamp(timestamp)
                .handlerWorkflowId(handlerWorkflowId)
                .handlerRunId(handlerRunId)
                .build();
    }

    private static String orUnknown(String value) {
        return value != null && !value.isBlank() ? value : UNKNOWN;
    }
}

package com.example.tenantsync.workflow;

import com.example.tenantsync.dto.DeadLetterEntry;
import com.example.tenantsync.dto.DeadLetterRequest;
import com.example.tenantsync.dto.ErrorInfo;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterEntryFactoryTest {

    private static final String TIMESTAMP = "2026-03-01T10:00:00Z";

    @Test
    void create_CopiesRequestAndStampsHandler() {
        DeadLetterRequest request = DeadLetterRequest.builder()
                .workflowId("tenant-sync-t1-1")
                .runId("run-1")
                .workflowType("TenantSyncWorkflow")
                .tenantId("t1")
                .error(ErrorInfo.builder().message("upstream down").type("WrapperApiException").phase("essential").build())
                .eventData(Map.of("tenantId", "t1"))
                .build();

        DeadLetterEntry entry = DeadLetterEntryFactory.create(request, TIMESTAMP, "dead-letter-1", "handler-run");

        assertThat(entry.getWorkflowId()).isEqualTo("tenant-sync-t1-1");
        assertThat(entry.getRunId()).isEqualTo("run-1");
        assertThat(entry.getWorkflowType()).isEqualTo("TenantSyncWorkflow");
        assertThat(entry.getTenantId()).isEqualTo("t1");
        assertThat(entry.getError().getMessage()).isEqualTo("upstream down");
        assertThat(entry.getError().getType()).isEqualTo("WrapperApiException");
        assertThat(entry.getError().getPhase()).isEqualTo("essential");
        assertThat(entry.getEventData()).containsEntry("tenantId", "t1");
        assertThat(entry.getTimestamp()).isEqualTo(TIMESTAMP);
        assertThat(entry.getHandlerWorkflowId()).isEqualTo("dead-letter-1");
        assertThat(entry.getHandlerRunId()).isEqualTo("handler-run");
    }

    @Test
    void create_FillsDefaultsForMissingFields() {
        DeadLetterRequest request = DeadLetterRequest.builder().workflowId("wf-1").build();

        DeadLetterEntry entry = DeadLetterEntryFactory.create(request, TIMESTAMP, "h", "r");

        assertThat(entry.getError().getMessage()).isEqualTo("Unknown error");
        assertThat(entry.getError().getType()).isEqualTo("unknown");
        assertThat(entry.getTenantId()).isEqualTo("unknown");
        assertThat(entry.getRunId()).isEqualTo("unknown");
        assertThat(entry.getEventData()).isEmpty();
    }

    @Test
    void create_ToleratesNullRequest() {
        DeadLetterEntry entry = DeadLetterEntryFactory.create(null, TIMESTAMP, "h", "r");

        assertThat(entry.getWorkflowId()).isEqualTo("unknown");
        assertThat(entry.getError().getMessage()).isEqualTo("Unknown error");
    }
}

package com.example.tenantsync.dto;

import com.example.common.events.OrganizationAssignmentEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of the per-tenant event processor.
 *
 * processedKeys is empty on first start and carries the idempotency ledger, oldest first,
 * across continue-as-new. pendingEvents carries events accepted but not yet dispatched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantEventProcessorInput {

    private String tenantId;

    @Builder.Default
    private List<String> processedKeys = new ArrayList<>();

    @Builder.Default
    private List<OrganizationAssignmentEvent> pendingEvents = new ArrayList<>();

    public static TenantEventProcessorInput fresh(String tenantId) {
        return TenantEventProcessorInput.builder().tenantId(tenantId).build();
    }
}

package com.example.tenantsync.workflow;

import lombok.Builder;
import lombok.Value;

/**
 * Limits of the per-tenant event processor.
 */
@Value
@Builder
public class EventProcessorSettings {

    /**
     * Idempotency keys retained; the oldest are evicted first beyond this.
     */
    @Builder.Default
    int ledgerCapacity = 10_000;

    /**
     * Dispatched events after which the processor continues as new, carrying the ledger.
     */
    @Builder.Default
    int continueAsNewAfter = 1_000;

    public static EventProcessorSettings defaults() {
        return EventProcessorSettings.builder().build();
    }
}

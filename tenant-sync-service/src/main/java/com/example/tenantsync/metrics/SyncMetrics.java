package com.example.tenantsync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - tenant_sync_phase_total: phase outcomes by phase and outcome (success, skipped, failure, partial_failure)
 * - tenant_sync_phase_duration_seconds: phase duration by phase
 * - tenant_sync_collection_failures_total: failed collection syncs by collection
 * - tenant_sync_lock_contention_total: phases skipped because another run held the lock
 * - tenant_sync_stuck_cleaned_total: in-progress syncs failed by the cleanup job
 * - assignment_events_total: assignment handler outcomes by event type
 * - dead_letters_total: dead-letter entries published by source workflow type
 *
 * Access metrics: http://localhost:8085/actuator/prometheus
 */
@Component
@Slf4j
public class SyncMetrics {

    public static final String PHASE_ESSENTIAL = "essential";
    public static final String PHASE_REFERENCE = "reference";
    public static final String PHASE_VALIDATION = "validation";

    private final MeterRegistry meterRegistry;

    private final Counter lockContentionCounter;
    private final Counter stuckSyncsCleanedCounter;

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.lockContentionCounter = Counter.builder("tenant_sync_lock_contention_total")
                .description("Sync phases skipped because another run held the tenant lock")
                .register(meterRegistry);

        this.stuckSyncsCleanedCounter = Counter.builder("tenant_sync_stuck_cleaned_total")
                .description("In-progress syncs marked failed after their lock expired")
                .register(meterRegistry);
    }

    public void recordPhaseSuccess(String phase, long durationMs) {
        phaseCounter(phase, "success").increment();
        phaseTimer(phase).record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded phase success: phase={}, duration={}ms", phase, durationMs);
    }

    /**
     * Phase finished but some non-critical collection failed.
     */
    public void recordPhasePartialFailure(String phase, long durationMs) {
        phaseCounter(phase, "partial_failure").increment();
        phaseTimer(phase).record(durationMs, TimeUnit.MILLISECONDS);
        log.warn("⚠️ Recorded phase partial failure: phase={}, duration={}ms", phase, durationMs);
    }

    public void recordPhaseFailure(String phase) {
        phaseCounter(phase, "failure").increment();
        log.debug("Recorded phase failure: phase={}", phase);
    }

    public void recordPhaseSkipped(String phase, String reason) {
        phaseCounter(phase, "skipped").increment();
        if ("sync_in_progress".equals(reason)) {
            lockContentionCounter.increment();
        }
        log.debug("Recorded phase skipped: phase={}, reason={}", phase, reason);
    }

    public void recordCollectionFailure(String collection) {
        Counter.builder("tenant_sync_collection_failures_total")
                .description("Failed collection syncs")
                .tag("collection", collection)
                .register(meterRegistry)
                .increment();
    }

    public void recordStuckSyncsCleaned(int count) {
        if (count > 0) {
            stuckSyncsCleanedCounter.increment(count);
        }
    }

    public void recordAssignmentEvent(String eventType, boolean success) {
        Counter.builder("assignment_events_total")
                .description("Organization assignment events handled")
                .tag("event_type", eventType)
                .tag("status", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
    }

    public void recordDeadLetter(String workflowType) {
        Counter.builder("dead_letters_total")
                .description("Dead-letter entries published")
                .tag("workflow_type", workflowType != null ? workflowType : "unknown")
                .register(meterRegistry)
                .increment();
        log.error("❌ Dead letter recorded for workflowType={}", workflowType);
    }

    private Counter phaseCounter(String phase, String outcome) {
        return Counter.builder("tenant_sync_phase_total")
                .description("Tenant sync phase outcomes")
                .tag("phase", phase)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    private Timer phaseTimer(String phase) {
        return Timer.builder("tenant_sync_phase_duration_seconds")
                .description("Duration of tenant sync phases")
                .tag("phase", phase)
                .register(meterRegistry);
    }
}

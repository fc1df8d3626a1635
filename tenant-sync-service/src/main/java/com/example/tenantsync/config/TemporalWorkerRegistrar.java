package com.example.tenantsync.config;

import com.example.tenantsync.activity.DeadLetterActivities;
import com.example.tenantsync.activity.OrganizationAssignmentActivities;
import com.example.tenantsync.activity.TenantSyncActivities;
import com.example.tenantsync.workflow.DeadLetterWorkflow;
import com.example.tenantsync.workflow.DeadLetterWorkflowImpl;
import com.example.tenantsync.workflow.SyncWorkflowPolicies;
import com.example.tenantsync.workflow.TenantEventProcessorWorkflow;
import com.example.tenantsync.workflow.TenantEventProcessorWorkflowImpl;
import com.example.tenantsync.workflow.TenantSyncWorkflow;
import com.example.tenantsync.workflow.TenantSyncWorkflowImpl;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Registers workflows and activities on the task queue and starts polling once the
 * application is ready. Disable with tenant-sync.temporal.worker-enabled=false to run a
 * client-only instance.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "tenant-sync.temporal.worker-enabled", havingValue = "true", matchIfMissing = true)
public class TemporalWorkerRegistrar {

    private final WorkerFactory workerFactory;
    private final SyncWorkflowPolicies policies;
    private final TenantSyncActivities tenantSyncActivities;
    private final OrganizationAssignmentActivities organizationAssignmentActivities;
    private final DeadLetterActivities deadLetterActivities;

    @EventListener(ApplicationReadyEvent.class)
    public void startWorker() {
        Worker worker = workerFactory.newWorker(policies.getTaskQueue());

        worker.registerWorkflowImplementationFactory(TenantSyncWorkflow.class,
                () -> new TenantSyncWorkflowImpl(policies));
        worker.registerWorkflowImplementationFactory(TenantEventProcessorWorkflow.class,
                () -> new TenantEventProcessorWorkflowImpl(policies));
        worker.registerWorkflowImplementationFactory(DeadLetterWorkflow.class, DeadLetterWorkflowImpl::new);

        worker.registerActivitiesImplementations(
                tenantSyncActivities, organizationAssignmentActivities, deadLetterActivities);

        workerFactory.start();
        log.info("✅ Temporal worker started: taskQueue={}", policies.getTaskQueue());
    }

    @PreDestroy
    public void stopWorker() throws InterruptedException {
        if (!workerFactory.isStarted()) {
            return;
        }
        log.info("Stopping Temporal worker: taskQueue={}", policies.getTaskQueue());
        workerFactory.shutdown();
        if (!workerFactory.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("⚠️ Temporal worker did not stop within 30s, forcing shutdown");
            workerFactory.shutdownNow();
        }
    }
}

package com.example.tenantsync.config;

import com.example.tenantsync.workflow.ActivityRetryPolicy;
import com.example.tenantsync.workflow.EventProcessorSettings;
import com.example.tenantsync.workflow.SyncWorkflowPolicies;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.WorkerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Temporal client and worker factory.
 *
 * Service stubs connect lazily, so the service starts even when the Temporal frontend is
 * down; calls then fail with ServiceUnavailableException at the facade.
 */
@Configuration
@Slf4j
public class TemporalConfig {

    @Bean(destroyMethod = "shutdown")
    public WorkflowServiceStubs workflowServiceStubs(
            @Value("${tenant-sync.temporal.target:localhost:7233}") String target) {
        log.info("Temporal frontend target: {}", target);
        return WorkflowServiceStubs.newServiceStubs(WorkflowServiceStubsOptions.newBuilder()
                .setTarget(target)
                .build());
    }

    @Bean
    public WorkflowClient workflowClient(
            WorkflowServiceStubs serviceStubs,
            @Value("${tenant-sync.temporal.namespace:default}") String namespace) {
        return WorkflowClient.newInstance(serviceStubs, WorkflowClientOptions.newBuilder()
                .setNamespace(namespace)
                .build());
    }

    @Bean
    public WorkerFactory workerFactory(WorkflowClient workflowClient) {
        return WorkerFactory.newInstance(workflowClient);
    }

    /**
     * Retry defaults live in {@link ActivityRetryPolicy}; only interval and attempts are overridable.
     */
    @Bean
    public SyncWorkflowPolicies syncWorkflowPolicies(
            @Value("${tenant-sync.temporal.task-queue:tenant-sync}") String taskQueue,
            @Value("${tenant-sync.temporal.retry.tenant-sync.initial-interval:5s}") Duration tenantSyncInterval,
            @Value("${tenant-sync.temporal.retry.tenant-sync.maximum-attempts:3}") int tenantSyncAttempts,
            @Value("${tenant-sync.temporal.retry.assignment-handlers.initial-interval:5s}") Duration handlerInterval,
            @Value("${tenant-sync.temporal.retry.assignment-handlers.maximum-attempts:3}") int handlerAttempts,
            @Value("${tenant-sync.temporal.retry.dead-letter-publish.initial-interval:1s}") Duration deadLetterInterval,
            @Value("${tenant-sync.temporal.retry.dead-letter-publish.maximum-attempts:3}") int deadLetterAttempts,
            @Value("${tenant-sync.event-processor.ledger-capacity:10000}") int ledgerCapacity,
            @Value("${tenant-sync.event-processor.continue-as-new-after:1000}") int continueAsNewAfter) {
        return SyncWorkflowPolicies.builder()
                .taskQueue(taskQueue)
                .tenantSync(ActivityRetryPolicy.forTenantSync().toBuilder()
                        .initialInterval(tenantSyncInterval)
                        .maximumAttempts(tenantSyncAttempts)
                        .build())
                .assignmentHandlers(ActivityRetryPolicy.forAssignmentHandlers().toBuilder()
                        .initialInterval(handlerInterval)
                        .maximumAttempts(handlerAttempts)
                        .build())
                .deadLetterPublish(ActivityRetryPolicy.forDeadLetterPublish().toBuilder()
                        .initialInterval(deadLetterInterval)
                        .maximumAttempts(deadLetterAttempts)
                        .build())
                .eventProcessor(EventProcessorSettings.builder()
                        .ledgerCapacity(ledgerCapacity)
                        .continueAsNewAfter(continueAsNewAfter)
                        .build())
                .build();
    }
}

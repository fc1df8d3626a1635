package com.example.tenantsync.workflow;

import com.example.common.events.OrganizationAssignmentEvent;
import com.example.common.events.OrganizationAssignmentEventType;
import com.example.tenantsync.activity.DeadLetterActivities;
import com.example.tenantsync.activity.OrganizationAssignmentActivities;
import com.example.tenantsync.dto.AssignmentHandlerInput;
import com.example.tenantsync.dto.DeadLetterEntry;
import com.example.tenantsync.dto.response.SyncExecutionResponse;
import com.example.tenantsync.exception.BadRequestException;
import com.example.tenantsync.service.TenantSyncWorkflowClient;
import io.temporal.client.WorkflowClient;
import io.temporal.testing.TestWorkflowEnvironment;
import io.temporal.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TenantEventProcessorWorkflowTest {

    private static final String TENANT = "t1";

    private TestWorkflowEnvironment testEnv;
    private WorkflowClient client;
    private TenantSyncWorkflowClient facade;
    private RecordingHandlers handlers;
    private RecordingDeadLetters deadLetters;

    @AfterEach
    void tearDown() {
        if (testEnv != null) {
            testEnv.close();
        }
    }

    @Test
    void redeliveredEvent_HandledOnce() throws Exception {
        start(EventProcessorSettings.defaults(), 2);

        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-2"));

        handlers.await();
        assertThat(handlers.calls()).containsExactly("created:a-1", "created:a-2");
        assertThat(processor().ledgerSize()).isEqualTo(2);
    }

    @Test
    void redeliveredWhileQueued_DroppedOnArrival() throws Exception {
        start(EventProcessorSettings.defaults(), 2);
        handlers.holdNext();

        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"));
        handlers.awaitHeld();
        for (int i = 0; i < 3; i++) {
            facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-2"));
        }

        long deadline = System.currentTimeMillis() + 10_000;
        while (processor().pendingEvents() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        Thread.sleep(500);
        assertThat(processor().pendingEvents()).isEqualTo(1);

        handlers.release();
        handlers.await();
        assertThat(handlers.calls()).containsExactly("created:a-1", "created:a-2");
        assertThat(processor().pendingEvents()).isZero();
        assertThat(processor().ledgerSize()).isEqualTo(2);
    }

    @Test
    void sameAssignmentDifferentType_BothHandled() throws Exception {
        start(EventProcessorSettings.defaults(), 3);

        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.DEACTIVATED, "a-1"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.DELETED, "a-1"));

        handlers.await();
        assertThat(handlers.calls()).containsExactly("created:a-1", "deactivated:a-1", "deleted:a-1");
    }

    @Test
    void events_DispatchedOneAtATimeInArrivalOrder() throws Exception {
        start(EventProcessorSettings.defaults(), 5);
        handlers.slowDown(30);

        for (int i = 1; i <= 5; i++) {
            facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.ACTIVATED, "a-" + i));
        }

        handlers.await();
        assertThat(handlers.calls())
                .containsExactly("activated:a-1", "activated:a-2", "activated:a-3", "activated:a-4", "activated:a-5");
        assertThat(handlers.maxConcurrent()).isEqualTo(1);
    }

    @Test
    void handlerFailure_DeadLetteredAndProcessingContinues() throws Exception {
        start(EventProcessorSettings.defaults(), 2);

        SyncExecutionResponse response =
                facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "boom"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-2"));

        handlers.await();
        deadLetters.await();
        assertThat(handlers.calls()).containsExactly("created:boom", "created:a-2");

        DeadLetterEntry entry = deadLetters.entries().get(0);
        assertThat(entry.getWorkflowId()).isEqualTo("org-assignment-t1").isEqualTo(response.getWorkflowId());
        assertThat(entry.getWorkflowType()).isEqualTo("TenantEventProcessorWorkflow");
        assertThat(entry.getTenantId()).isEqualTo(TENANT);
        assertThat(entry.getError().getType()).isEqualTo(IllegalStateException.class.getName());
        assertThat(entry.getEventData())
                .containsEntry("type", "created")
                .containsEntry("assignmentId", "boom")
                .containsEntry("userId", "u-1");

        // a failed event stays in the ledger
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "boom"));
        assertThat(processor().ledgerSize()).isEqualTo(2);
    }

    @Test
    void continueAsNew_LedgerCarriedOver() throws Exception {
        start(EventProcessorSettings.builder().continueAsNewAfter(2).build(), 3);
        String firstRunId = facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"))
                .getRunId();
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-2"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-3"));
        handlers.await();

        handlers.expect(1);
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"));
        SyncExecutionResponse latest =
                facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-4"));
        handlers.await();

        assertThat(handlers.calls()).containsExactly("created:a-1", "created:a-2", "created:a-3", "created:a-4");
        assertThat(latest.getRunId()).isNotEqualTo(firstRunId);
        assertThat(processor().ledgerSize()).isEqualTo(4);
    }

    @Test
    void ledgerCapacity_OldestKeysEvicted() throws Exception {
        start(EventProcessorSettings.builder().ledgerCapacity(2).build(), 3);

        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-2"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-3"));
        handlers.await();

        handlers.expect(1);
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"));
        handlers.await();

        assertThat(handlers.calls()).containsExactly("created:a-1", "created:a-2", "created:a-3", "created:a-1");
        assertThat(processor().ledgerSize()).isEqualTo(2);
    }

    @Test
    void eventWithoutType_DroppedBySignalHandler() throws Exception {
        start(EventProcessorSettings.defaults(), 2);
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.CREATED, "a-1"));

        processor().onAssignmentEvent(event(null, "a-2"));
        facade.sendAssignmentEvent(TENANT, event(OrganizationAssignmentEventType.DELETED, "a-3"));

        handlers.await();
        assertThat(handlers.calls()).containsExactly("created:a-1", "deleted:a-3");
        assertThat(processor().pendingEvents()).isZero();
    }

    @Test
    void workflowClient_EventWithoutType_Rejected() {
        start(EventProcessorSettings.defaults(), 0);

        assertThatThrownBy(() -> facade.sendAssignmentEvent(TENANT, event(null, "a-1")))
                .isInstanceOf(BadRequestException.class);
    }

    private void start(EventProcessorSettings settings, int expectedCalls) {
        SyncWorkflowPolicies policies = TestPolicies.fast(settings);
        testEnv = TestWorkflowEnvironment.newInstance();
        Worker worker = testEnv.newWorker(TestPolicies.TASK_QUEUE);
        worker.registerWorkflowImplementationFactory(TenantEventProcessorWorkflow.class,
                () -> new TenantEventProcessorWorkflowImpl(policies));
        worker.registerWorkflowImplementationFactory(DeadLetterWorkflow.class, DeadLetterWorkflowImpl::new);

        handlers = new RecordingHandlers();
        handlers.expect(expectedCalls);
        deadLetters = new RecordingDeadLetters();
        worker.registerActivitiesImplementations(handlers, deadLetters);

        testEnv.start();
        client = testEnv.getWorkflowClient();
        facade = new TenantSyncWorkflowClient(client, policies, Clock.systemUTC());
    }

    private TenantEventProcessorWorkflow processor() {
        return client.newWorkflowStub(TenantEventProcessorWorkflow.class, "org-assignment-" + TENANT);
    }

    private static OrganizationAssignmentEvent event(OrganizationAssignmentEventType type, String assignmentId) {
        return OrganizationAssignmentEvent.builder()
                .type(type)
                .assignmentId(assignmentId)
                .userId("u-1")
                .organizationId("org-1")
                .build();
    }

    /**
     * Records handler calls as "type:assignmentId"; assignment "boom" always fails.
     */
    static class RecordingHandlers implements OrganizationAssignmentActivities {

        private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
        private final AtomicInteger active = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();
        private volatile CountDownLatch latch = new CountDownLatch(0);
        private volatile long delayMs;
        private volatile CountDownLatch gate = new CountDownLatch(0);
        private volatile CountDownLatch held = new CountDownLatch(0);

        /**
         * The next handler call blocks until {@link #release()}.
         */
        void holdNext() {
            held = new CountDownLatch(1);
            gate = new CountDownLatch(1);
        }

        void awaitHeld() throws InterruptedException {
            assertThat(held.await(30, TimeUnit.SECONDS)).as("handler entered in time").isTrue();
        }

        void release() {
            gate.countDown();
        }

        void expect(int count) {
            latch = new CountDownLatch(count);
        }

        void slowDown(long millis) {
            delayMs = millis;
        }

        void await() throws InterruptedException {
            assertThat(latch.await(30, TimeUnit.SECONDS)).as("handlers invoked in time").isTrue();
        }

        List<String> calls() {
            synchronized (calls) {
                return new ArrayList<>(calls);
            }
        }

        int maxConcurrent() {
            return maxConcurrent.get();
        }

        @Override
        public void handleOrganizationAssignmentCreated(AssignmentHandlerInput input) {
            record("created", input);
        }

        @Override
        public void handleOrganizationAssignmentDeleted(AssignmentHandlerInput input) {
            record("deleted", input);
        }

        @Override
        public void handleOrganizationAssignmentActivated(AssignmentHandlerInput input) {
            record("activated", input);
        }

        @Override
        public void handleOrganizationAssignmentDeactivated(AssignmentHandlerInput input) {
            record("deactivated", input);
        }

        private void record(String type, AssignmentHandlerInput input) {
            int now = active.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                if (held.getCount() > 0) {
                    held.countDown();
                    gate.await(30, TimeUnit.SECONDS);
                }
                if (delayMs > 0) {
                    Thread.sleep(delayMs);
                }
                if ("boom".equals(input.getAssignmentId())) {
                    // recorded once across retries
                    if (calls.stream().noneMatch(call -> call.equals(type + ":boom"))) {
                        calls.add(type + ":boom");
                        latch.countDown();
                    }
                    throw new IllegalStateException("handler exploded for " + input.getAssignmentId());
                }
                calls.add(type + ":" + input.getAssignmentId());
                latch.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } finally {
                active.decrementAndGet();
            }
        }
    }

    static class RecordingDeadLetters implements DeadLetterActivities {

        private final List<DeadLetterEntry> entries = Collections.synchronizedList(new ArrayList<>());
        private final CountDownLatch latch = new CountDownLatch(1);

        void await() throws InterruptedException {
            assertThat(latch.await(30, TimeUnit.SECONDS)).as("dead letter published in time").isTrue();
        }

        List<DeadLetterEntry> entries() {
            synchronized (entries) {
                return new ArrayList<>(entries);
            }
        }

        @Override
        public void publishDeadLetter(DeadLetterEntry entry) {
            entries.add(entry);
            latch.countDown();
        }
    }
}

package com.example.tenantsync.activity;

import com.example.tenantsync.dto.DeadLetterEntry;
import com.example.tenantsync.event.DeadLetterPublisher;
import com.example.tenantsync.metrics.SyncMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeadLetterActivitiesImpl implements DeadLetterActivities {

    private final DeadLetterPublisher deadLetterPublisher;
    private final SyncMetrics syncMetrics;

    @Override
    public void publishDeadLetter(DeadLetterEntry entry) {
        deadLetterPublisher.publish(entry);
        syncMetrics.recordDeadLetter(entry.getWorkflowType());
    }
}

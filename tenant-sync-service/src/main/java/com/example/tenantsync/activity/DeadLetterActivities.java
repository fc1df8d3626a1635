package com.example.tenantsync.activity;

import com.example.tenantsync.dto.DeadLetterEntry;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

@ActivityInterface
public interface DeadLetterActivities {

    /**
     * Hand a dead-letter entry to the external publisher.
     */
    @ActivityMethod
    void publishDeadLetter(DeadLetterEntry entry);
}

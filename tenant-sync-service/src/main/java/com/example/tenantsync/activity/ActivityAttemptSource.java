package com.example.tenantsync.activity;

import io.temporal.activity.Activity;
import org.springframework.stereotype.Component;

/**
 * Attempt number of the activity running on the current thread (1 for the first try).
 */
@Component
public class ActivityAttemptSource {

    public int currentAttempt() {
        return Activity.getExecutionContext().getInfo().getAttempt();
    }
}

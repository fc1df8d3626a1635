package com.example.tenantsync.workflow;

import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Timeout and bounded exponential backoff applied to one family of activity calls.
 *
 * Handed to each workflow implementation explicitly so orchestrator and event processor
 * can be built and tested with their own policies.
 */
@Value
@Builder(toBuilder = true)
public class ActivityRetryPolicy {

    Duration startToCloseTimeout;

    Duration initialInterval;

    double backoffCoefficient;

    Duration maximumInterval;

    int maximumAttempts;

    @Builder.Default
    List<String> nonRetryableErrorTypes = SyncErrorTypes.NON_RETRYABLE;

    public ActivityOptions toActivityOptions() {
        return ActivityOptions.newBuilder()
                .setStartToCloseTimeout(startToCloseTimeout)
                .setRetryOptions(toRetryOptions())
                .build();
    }

    public RetryOptions toRetryOptions() {
        return RetryOptions.newBuilder()
                .setInitialInterval(initialInterval)
                .setBackoffCoefficient(backoffCoefficient)
                .setMaximumInterval(maximumInterval)
                .setMaximumAttempts(maximumAttempts)
                .setDoNotRetry(nonRetryableErrorTypes.toArray(new String[0]))
                .build();
    }

    /**
     * Essential, reference and validation activities: 25 min, 5s doubling up to 300s, 3 attempts.
     * The timeout stays below the tenant lock TTL (tenant-sync.lock.ttl, 30 min).
     */
    public static ActivityRetryPolicy forTenantSync() {
        return ActivityRetryPolicy.builder()
                .startToCloseTimeout(Duration.ofMinutes(25))
                .initialInterval(Duration.ofSeconds(5))
                .backoffCoefficient(2.0)
                .maximumInterval(Duration.ofSeconds(300))
                .maximumAttempts(3)
                .build();
    }

    /**
     * Organization assignment handlers: 5 min, 5s doubling up to 60s, 3 attempts.
     */
    public static ActivityRetryPolicy forAssignmentHandlers() {
        return ActivityRetryPolicy.builder()
                .startToCloseTimeout(Duration.ofMinutes(5))
                .initialInterval(Duration.ofSeconds(5))
                .backoffCoefficient(2.0)
                .maximumInterval(Duration.ofSeconds(60))
                .maximumAttempts(3)
                .build();
    }

    public static ActivityRetryPolicy forDeadLetterPublish() {
        return ActivityRetryPolicy.builder()
                .startToCloseTimeout(Duration.ofMinutes(1))
                .initialInterval(Duration.ofSeconds(1))
                .backoffCoefficient(2.0)
                .maximumInterval(Duration.ofSeconds(100))
                .maximumAttempts(3)
                .build();
    }
}

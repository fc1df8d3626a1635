package com.example.tenantsync.scheduler;

import com.example.tenantsync.metrics.SyncMetrics;
import com.example.tenantsync.service.SyncStatusStore;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Fails tenant syncs left in progress by a worker that died without releasing its lock.
 *
 * @SchedulerLock keeps the job to one replica per tick.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "tenant-sync.cleanup.enabled", havingValue = "true", matchIfMissing = true)
public class StuckSyncCleanupScheduler {

    private final SyncStatusStore statusStore;
    private final SyncMetrics syncMetrics;
    private final Duration stuckThreshold;

    public StuckSyncCleanupScheduler(SyncStatusStore statusStore,
                                     SyncMetrics syncMetrics,
                                     @Value("${tenant-sync.cleanup.stuck-threshold:10m}") Duration stuckThreshold) {
        this.statusStore = statusStore;
        this.syncMetrics = syncMetrics;
        this.stuckThreshold = stuckThreshold;
    }

    /**
     * Default: every 5 minutes.
     */
    @Scheduled(cron = "${tenant-sync.cleanup.cron:0 */5 * * * *}")
    @SchedulerLock(
            name = "cleanupStuckTenantSyncs",
            lockAtMostFor = "4m",
            lockAtLeastFor = "30s"
    )
    public void cleanupStuckSyncs() {
        String correlationId = "SCHEDULER-CLEANUP-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            int cleaned = statusStore.cleanupStuckSyncs(stuckThreshold);
            syncMetrics.recordStuckSyncsCleaned(cleaned);
            if (cleaned > 0) {
                log.warn("⚠️ Stuck sync cleanup failed {} tenant syncs (threshold={})", cleaned, stuckThreshold);
            } else {
                log.debug("Stuck sync cleanup: nothing to do");
            }
        } catch (Exception e) {
            log.error("Error in stuck sync cleanup: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}

package com.example.tenantsync.activity;

import com.example.tenantsync.dto.PhaseActivityInput;
import com.example.tenantsync.dto.PhaseActivityResult;
import com.example.tenantsync.dto.ValidationActivityResult;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/**
 * The three phases of a tenant sync, each an independently retried unit of work.
 */
@ActivityInterface
public interface TenantSyncActivities {

    /**
     * Tenant record, organizations, roles and users, then role assignments (failure tolerated).
     * Skips with already_synced or sync_in_progress instead of doing work when appropriate.
     */
    @ActivityMethod
    PhaseActivityResult syncEssentialData(PhaseActivityInput input);

    /**
     * Role assignments, employee assignments, credit configs and entity credits, each
     * collection independently. Rejected before the essential phase has run.
     */
    @ActivityMethod
    PhaseActivityResult syncReferenceData(PhaseActivityInput input);

    @ActivityMethod
    ValidationActivityResult validateSyncCompletion(String tenantId);
}

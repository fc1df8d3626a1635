package com.example.tenantsync.activity;

import com.example.tenantsync.dto.AssignmentHandlerInput;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/**
 * Apply one organization assignment change to the tenant's local employee assignments.
 */
@ActivityInterface
public interface OrganizationAssignmentActivities {

    @ActivityMethod
    void handleOrganizationAssignmentCreated(AssignmentHandlerInput input);

    @ActivityMethod
    void handleOrganizationAssignmentDeleted(AssignmentHandlerInput input);

    @ActivityMethod
    void handleOrganizationAssignmentActivated(AssignmentHandlerInput input);

    @ActivityMethod
    void handleOrganizationAssignmentDeactivated(AssignmentHandlerInput input);
}

package com.example.tenantsync.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of the trigger and run endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncTriggerRequest {

    private boolean forceSync;

    private boolean skipReferenceData;
}

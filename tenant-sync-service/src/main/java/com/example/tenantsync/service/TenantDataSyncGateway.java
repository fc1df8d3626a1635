package com.example.tenantsync.service;

import com.example.tenantsync.entity.SyncCollection;

/**
 * Pulls one upstream collection for a tenant into the local store.
 */
public interface TenantDataSyncGateway {

    /**
     * Fetch and upsert every record of {@code collection}.
     *
     * @return number of records stored
     * @throws RuntimeException when the upstream fetch or the local write fails
     */
    int syncCollection(String tenantId, String authToken, SyncCollection collection);
}

package com.example.tenantsync.repository;

import com.example.tenantsync.entity.SyncedRecord;

import java.util.List;

/**
 * Custom repository interface for SyncedRecord UPSERT operations.
 */
public interface SyncedRecordRepositoryCustom {

    /**
     * Batch UPSERT keyed by (tenant, collection, external id) using PostgreSQL ON CONFLICT.
     * Idempotent: safe to call again with the same data on activity retry.
     *
     * @return number of rows affected (inserted + updated)
     */
    int upsertBatch(List<SyncedRecord> records);
}

package com.example.tenantsync.repository;

import com.example.tenantsync.entity.SyncedRecord;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Native PostgreSQL UPSERT for synced upstream records.
 *
 * Re-running a collection sync (activity retry, forced resync) rewrites the payload in place
 * instead of violating the (tenant_id, collection_name, external_id) constraint.
 */
@Repository
@Slf4j
public class SyncedRecordRepositoryImpl implements SyncedRecordRepositoryCustom {

    private static final int BATCH_SIZE = 500;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public int upsertBatch(List<SyncedRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        int totalAffected = 0;
        for (int start = 0; start < records.size(); start += BATCH_SIZE) {
            int end = Math.min(start + BATCH_SIZE, records.size());
            totalAffected += executeBatchUpsert(records.subList(start, end));
        }

        entityManager.flush();
        entityManager.clear();

        log.debug("Batch upserted {} synced records in {} batches", totalAffected,
                (records.size() + BATCH_SIZE - 1) / BATCH_SIZE);
        return totalAffected;
    }

    private int executeBatchUpsert(List<SyncedRecord> batch) {
        StringBuilder sql = new StringBuilder("""
                INSERT INTO synced_records (
                    tenant_id, collection_name, external_id,
                    payload, synced_at, created_at, updated_at
                ) VALUES
                """);

        for (int i = 0; i < batch.size(); i++) {
            sql.append("(?, ?, ?, ?, ?, ?, ?)");
            if (i < batch.size() - 1) {
                sql.append(",\n");
            }
        }

        sql.append("""

                ON CONFLICT (tenant_id, collection_name, external_id)
                DO UPDATE SET
                    payload = EXCLUDED.payload,
                    synced_at = EXCLUDED.synced_at,
                    updated_at = EXCLUDED.updated_at
                """);

        Query query = entityManager.createNativeQuery(sql.toString());

        int paramIndex = 1;
        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        for (SyncedRecord record : batch) {
            Instant syncedAt = record.getSyncedAt() != null ? record.getSyncedAt() : Instant.now();
            query.setParameter(paramIndex++, record.getTenantId());
            query.setParameter(paramIndex++, record.getCollection().name());
            query.setParameter(paramIndex++, record.getExternalId());
            query.setParameter(paramIndex++, record.getPayload());
            query.setParameter(paramIndex++, Timestamp.from(syncedAt));
            query.setParameter(paramIndex++, now);
            query.setParameter(paramIndex++, now);
        }

        return query.executeUpdate();
    }
}

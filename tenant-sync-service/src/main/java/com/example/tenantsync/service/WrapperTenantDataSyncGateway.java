package com.example.tenantsync.service;

import com.example.tenantsync.client.external.WrapperApiClient;
import com.example.tenantsync.entity.SyncCollection;
import com.example.tenantsync.entity.SyncedRecord;
import com.example.tenantsync.repository.SyncedRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gateway backed by the wrapper API: fetch OUTSIDE a transaction, then batch upsert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WrapperTenantDataSyncGateway implements TenantDataSyncGateway {

    private final WrapperApiClient wrapperApiClient;
    private final SyncedRecordRepository syncedRecordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public int syncCollection(String tenantId, String authToken, SyncCollection collection) {
        List<Map<String, Object>> upstream = wrapperApiClient.fetchCollection(tenantId, authToken, collection);

        Instant now = clock.instant();
        List<SyncedRecord> records = new ArrayList<>(upstream.size());
        int skipped = 0;
        for (Map<String, Object> item : upstream) {
            String externalId = externalIdOf(tenantId, collection, item);
            if (externalId == null) {
                skipped++;
                continue;
            }
            records.add(SyncedRecord.builder()
                    .tenantId(tenantId)
                    .collection(collection)
                    .externalId(externalId)
                    .payload(toJson(item))
                    .syncedAt(now)
                    .build());
        }

        if (skipped > 0) {
            log.warn("Skipped {} {} records without an id for tenantId={}",
                    skipped, collection.getCollectionName(), tenantId);
        }

        syncedRecordRepository.upsertBatch(records);
        log.info("Synced {} {} records for tenantId={}", records.size(), collection.getCollectionName(), tenantId);
        return records.size();
    }

    private static String externalIdOf(String tenantId, SyncCollection collection, Map<String, Object> item) {
        if (collection == SyncCollection.TENANTS) {
            return tenantId;
        }
        Object id = item.get("_id");
        if (id == null) {
            id = item.get("id");
        }
        return id != null ? id.toString() : null;
    }

    private String toJson(Map<String, Object> item) {
        try {
            return objectMapper.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize upstream record: " + e.getMessage(), e);
        }
    }
}

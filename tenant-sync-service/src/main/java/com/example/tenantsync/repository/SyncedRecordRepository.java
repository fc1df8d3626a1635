package com.example.tenantsync.repository;

import com.example.tenantsync.entity.SyncCollection;
import com.example.tenantsync.entity.SyncedRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface SyncedRecordRepository extends JpaRepository<SyncedRecord, Long>, SyncedRecordRepositoryCustom {

    boolean existsByTenantIdAndCollection(String tenantId, SyncCollection collection);

    long countByTenantIdAndCollection(String tenantId, SyncCollection collection);

    Optional<SyncedRecord> findByTenantIdAndCollectionAndExternalId(String tenantId,
                                                                    SyncCollection collection,
                                                                    String externalId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM SyncedRecord r WHERE r.tenantId = :tenantId " +
            "AND r.collection = :collection AND r.externalId = :externalId")
    int deleteRecord(@Param("tenantId") String tenantId,
                     @Param("collection") SyncCollection collection,
                     @Param("externalId") String externalId);
}

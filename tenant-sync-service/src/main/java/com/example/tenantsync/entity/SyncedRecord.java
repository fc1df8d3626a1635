package com.example.tenantsync.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Local copy of one upstream record, stored as an opaque JSON document.
 * Written through the native upsert in SyncedRecordRepositoryImpl.
 */
@Entity
@Table(name = "synced_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_synced_records_tenant_collection_external",
                        columnNames = {"tenant_id", "collection_name", "external_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncedRecord extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "collection_name", nullable = false, length = 50)
    private SyncCollection collection;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "synced_at", nullable = false)
    private Instant syncedAt;
}

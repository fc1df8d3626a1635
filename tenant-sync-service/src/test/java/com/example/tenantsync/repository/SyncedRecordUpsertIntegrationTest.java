package com.example.tenantsync.repository;

import com.example.tenantsync.entity.SyncCollection;
import com.example.tenantsync.entity.SyncedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;

/**
 * Upsert idempotency of synced records against a real PostgreSQL (ON CONFLICT is not portable).
 */
@DataJpaTest(excludeAutoConfiguration = {FlywayAutoConfiguration.class})
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(SyncedRecordRepositoryImpl.class)
class SyncedRecordUpsertIntegrationTest {

    private static final Instant SYNCED_AT_T1 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant SYNCED_AT_T2 = Instant.parse("2026-03-01T11:30:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private SyncedRecordRepository syncedRecordRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        syncedRecordRepository.deleteAll();
    }

    @Test
    void upsertBatch_ActivityRetry_NoDuplicates() {
        List<SyncedRecord> users = List.of(
                record("tenant-1", SyncCollection.USERS, "u-1", "{\"name\":\"Ann\"}", SYNCED_AT_T1),
                record("tenant-1", SyncCollection.USERS, "u-2", "{\"name\":\"Bob\"}", SYNCED_AT_T1),
                record("tenant-1", SyncCollection.USERS, "u-3", "{\"name\":\"Cid\"}", SYNCED_AT_T1));

        int firstRun = syncedRecordRepository.upsertBatch(users);
        assertThatNoException().isThrownBy(() -> syncedRecordRepository.upsertBatch(users));

        assertThat(firstRun).isEqualTo(3);
        assertThat(syncedRecordRepository.count()).isEqualTo(3);
        Integer duplicates = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM (SELECT tenant_id, collection_name, external_id FROM synced_records "
                        + "GROUP BY tenant_id, collection_name, external_id HAVING COUNT(*) > 1) AS dups",
                Integer.class);
        assertThat(duplicates).isZero();
    }

    @Test
    void upsertBatch_ChangedUpstreamRecord_PayloadAndSyncTimeReplaced() {
        syncedRecordRepository.upsertBatch(List.of(
                record("tenant-1", SyncCollection.ROLES, "r-1", "{\"name\":\"viewer\"}", SYNCED_AT_T1)));

        syncedRecordRepository.upsertBatch(List.of(
                record("tenant-1", SyncCollection.ROLES, "r-1", "{\"name\":\"editor\"}", SYNCED_AT_T2)));

        SyncedRecord stored = syncedRecordRepository
                .findByTenantIdAndCollectionAndExternalId("tenant-1", SyncCollection.ROLES, "r-1")
                .orElseThrow();
        assertThat(stored.getPayload()).isEqualTo("{\"name\":\"editor\"}");
        assertThat(stored.getSyncedAt()).isEqualTo(SYNCED_AT_T2);
        assertThat(syncedRecordRepository.count()).isEqualTo(1);
    }

    @Test
    void upsertBatch_SameExternalIdInOtherTenantOrCollection_KeptApart() {
        syncedRecordRepository.upsertBatch(List.of(
                record("tenant-1", SyncCollection.ORGANIZATIONS, "42", "{}", SYNCED_AT_T1),
                record("tenant-2", SyncCollection.ORGANIZATIONS, "42", "{}", SYNCED_AT_T1),
                record("tenant-1", SyncCollection.ROLES, "42", "{}", SYNCED_AT_T1)));

        assertThat(syncedRecordRepository.count()).isEqualTo(3);
        assertThat(syncedRecordRepository.countByTenantIdAndCollection("tenant-1", SyncCollection.ORGANIZATIONS))
                .isEqualTo(1);
    }

    @Test
    void upsertBatch_MoreThanOneChunk_AllWritten() {
        List<SyncedRecord> assignments = new ArrayList<>();
        for (int i = 1; i <= 1200; i++) {
            assignments.add(record("tenant-1", SyncCollection.EMPLOYEE_ASSIGNMENTS, "ea-" + i, "{}", SYNCED_AT_T1));
        }

        syncedRecordRepository.upsertBatch(assignments);
        syncedRecordRepository.upsertBatch(assignments);

        assertThat(syncedRecordRepository.countByTenantIdAndCollection("tenant-1", SyncCollection.EMPLOYEE_ASSIGNMENTS))
                .isEqualTo(1200);
    }

    @Test
    void deleteRecord_RemovesOnlyTheAddressedRecord() {
        syncedRecordRepository.upsertBatch(List.of(
                record("tenant-1", SyncCollection.EMPLOYEE_ASSIGNMENTS, "ea-1", "{}", SYNCED_AT_T1),
                record("tenant-1", SyncCollection.EMPLOYEE_ASSIGNMENTS, "ea-2", "{}", SYNCED_AT_T1)));

        int deleted = syncedRecordRepository.deleteRecord("tenant-1", SyncCollection.EMPLOYEE_ASSIGNMENTS, "ea-1");
        int deletedAgain = syncedRecordRepository.deleteRecord("tenant-1", SyncCollection.EMPLOYEE_ASSIGNMENTS, "ea-1");

        assertThat(deleted).isEqualTo(1);
        assertThat(deletedAgain).isZero();
        assertThat(syncedRecordRepository.count()).isEqualTo(1);
    }

    @Test
    void upsertBatch_EmptyInput_NothingWritten() {
        assertThat(syncedRecordRepository.upsertBatch(List.of())).isZero();
        assertThat(syncedRecordRepository.upsertBatch(null)).isZero();
    }

    private static SyncedRecord record(String tenantId, SyncCollection collection, String externalId,
                                       String payload, Instant syncedAt) {
        return SyncedRecord.builder()
                .tenantId(tenantId)
                .collection(collection)
                .externalId(externalId)
                .payload(payload)
                .syncedAt(syncedAt)
                .build();
    }
}

package com.example.tenantsync.entity;

import java.util.Arrays;
import java.util.List;

/**
 * Upstream collections pulled into the local store for a tenant.
 *
 * Declaration order is the order the essential phase syncs them in:
 * the tenant record first, then organizations, roles and users, then role assignments.
 */
public enum SyncCollection {
    TENANTS("tenants", "", Tier.ESSENTIAL),
    ORGANIZATIONS("organizations", "/organizations", Tier.ESSENTIAL),
    ROLES("roles", "/roles", Tier.ESSENTIAL),
    USERS("users", "/users", Tier.ESSENTIAL),
    ROLE_ASSIGNMENTS("roleAssignments", "/role-assignments", Tier.TOLERATED),
    EMPLOYEE_ASSIGNMENTS("employeeAssignments", "/employee-assignments", Tier.REFERENCE),
    CREDIT_CONFIGS("creditConfigs", "/credit-configs", Tier.REFERENCE),
    ENTITY_CREDITS("entityCredits", "/entity-credits", Tier.REFERENCE);

    /**
     * ESSENTIAL failures block completion. TOLERATED collections are synced with the
     * essential phase but their failure only marks a partial failure. REFERENCE
     * collections belong to the reference phase.
     */
    public enum Tier {
        ESSENTIAL,
        TOLERATED,
        REFERENCE
    }

    private final String collectionName;
    private final String upstreamPath;
    private final Tier tier;

    SyncCollection(String collectionName, String upstreamPath, Tier tier) {
        this.collectionName = collectionName;
        this.upstreamPath = upstreamPath;
        this.tier = tier;
    }

    public String getCollectionName() {
        return collectionName;
    }

    /**
     * Path suffix below /api/wrapper/tenants/{tenantId}.
     */
    public String getUpstreamPath() {
        return upstreamPath;
    }

    public Tier getTier() {
        return tier;
    }

    public boolean isEssential() {
        return tier == Tier.ESSENTIAL;
    }

    /**
     * Reference collections never block {@code status=completed}; role assignments count as one.
     */
    public boolean isReference() {
        return tier != Tier.ESSENTIAL;
    }

    public static List<SyncCollection> essentialCollections() {
        return Arrays.stream(values()).filter(SyncCollection::isEssential).toList();
    }

    public static List<SyncCollection> toleratedCollections() {
        return Arrays.stream(values()).filter(collection -> collection.tier == Tier.TOLERATED).toList();
    }

    public static List<SyncCollection> referenceCollections() {
        return Arrays.stream(values()).filter(SyncCollection::isReference).toList();
    }
}

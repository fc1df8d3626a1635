package com.example.common.events;

import java.util.Arrays;

/**
 * Kinds of organization assignment change delivered to a tenant's event processor.
 */
public enum OrganizationAssignmentEventType {
    CREATED("created"),
    DELETED("deleted"),
    ACTIVATED("activated"),
    DEACTIVATED("deactivated");

    private final String wireName;

    OrganizationAssignmentEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a type from its wire name ("created", "deleted", ...).
     *
     * @throws IllegalArgumentException for unknown or blank names
     */
    public static OrganizationAssignmentEventType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown organization assignment event type: " + value));
    }
}

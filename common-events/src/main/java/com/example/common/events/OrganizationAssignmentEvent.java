package com.example.common.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Organization Assignment Event
 *
 * Delivered (at least once) to the per-tenant event processor whenever an employee's
 * organization assignment changes in the system of record.
 *
 * Tagged variant: {@link #type} selects the handler, the remaining fields are the payload.
 * Anything beyond the identifying triple travels in {@link #attributes}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationAssignmentEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private OrganizationAssignmentEventType type;

    private String assignmentId;

    private String userId;

    private String organizationId;

    /**
     * Extra payload fields (role, position, effective dates...), passed through to handlers untouched.
     */
    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    /**
     * Event ID (UUID) assigned by the producer, informational only.
     * Deduplication uses {@link #idempotencyKey()}, not this value.
     */
    private String eventId;

    private Instant eventTimestamp;

    /**
     * Composite key "{type}-{assignmentId}-{userId}-{organizationId}".
     * Two deliveries of the same logical change share a key.
     */
    public String idempotencyKey() {
        String typeName = type != null ? type.wireName() : null;
        return typeName + "-" + assignmentId + "-" + userId + "-" + organizationId;
    }
}

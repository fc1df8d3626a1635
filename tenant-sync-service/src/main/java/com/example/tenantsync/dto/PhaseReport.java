package com.example.tenantsync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-phase entry of a tenant sync result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PhaseReport {

    private boolean success;

    private boolean skipped;

    private String reason;

    private SyncStats stats;

    private long durationMs;

    private ErrorInfo error;

    /**
     * Validation phase only.
     */
    private Boolean valid;

    /**
     * Validation phase only.
     */
    private List<String> issues;
}

package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of the validation activity. {@code valid} ignores non-critical issues.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationActivityResult {

    private boolean success;

    private boolean valid;

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    private TenantSyncStatusView syncStatus;

    private ErrorInfo error;
}

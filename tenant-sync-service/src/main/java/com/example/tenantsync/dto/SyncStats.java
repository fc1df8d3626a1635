package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record counts of a phase, keyed by collection name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncStats {

    private int totalRecords;

    @Builder.Default
    private Map<String, Integer> recordCounts = new LinkedHashMap<>();

    @Builder.Default
    private List<String> failedCollections = new ArrayList<>();
}

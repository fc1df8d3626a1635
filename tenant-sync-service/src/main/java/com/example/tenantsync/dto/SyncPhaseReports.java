package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncPhaseReports {

    private PhaseReport essential;

    private PhaseReport reference;

    private PhaseReport validation;
}

package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterResult {

    private boolean success;

    private DeadLetterEntry dlqEntry;

    private String message;
}

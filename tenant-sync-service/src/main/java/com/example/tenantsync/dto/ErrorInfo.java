package com.example.tenantsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serializable description of a failure, carried in results and dead-letter entries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorInfo {

    private String message;

    /**
     * Failure type: ValidationError, NotFoundError, or the exception class name.
     */
    private String type;

    private String stack;

    /**
     * Phase that failed, set only on the orchestration-level error.
     */
    private String phase;

    public static ErrorInfo of(String message, String type) {
        return ErrorInfo.builder().message(message).type(type).build();
    }
}

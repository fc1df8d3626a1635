package com.example.tenantsync.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for conflict errors (HTTP 409).
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    /**
     * A sync workflow with the same id is already running.
     */
    public static ConflictException syncAlreadyRunning(String workflowId) {
        return new ConflictException(
            "SYNC_ALREADY_RUNNING",
            String.format("Sync workflow %s is already running", workflowId)
        );
    }
}

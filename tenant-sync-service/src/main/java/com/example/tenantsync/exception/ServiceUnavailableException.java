package com.example.tenantsync.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for unavailable downstream services (HTTP 503).
 * Raised when the workflow engine cannot be reached.
 */
public class ServiceUnavailableException extends BaseException {

    public ServiceUnavailableException(String code, String message) {
        super(code, message, HttpStatus.SERVICE_UNAVAILABLE);
    }

    public static ServiceUnavailableException workflowEngineUnavailable(String detail) {
        return new ServiceUnavailableException(
            "WORKFLOW_ENGINE_UNAVAILABLE",
            String.format("Workflow engine unavailable: %s", detail)
        );
    }
}

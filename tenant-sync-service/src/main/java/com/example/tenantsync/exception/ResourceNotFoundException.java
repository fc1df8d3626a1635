package com.example.tenantsync.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    /**
     * No sync status document exists for the tenant.
     */
    public static ResourceNotFoundException syncStatusNotFound(String tenantId) {
        return new ResourceNotFoundException(
            "SYNC_STATUS_NOT_FOUND",
            String.format("No sync status found for tenant %s", tenantId)
        );
    }
}

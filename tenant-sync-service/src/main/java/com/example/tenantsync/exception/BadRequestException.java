package com.example.tenantsync.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for invalid requests (HTTP 400).
 */
public class BadRequestException extends BaseException {

    public BadRequestException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public static BadRequestException missingAuthToken() {
        return new BadRequestException(
            "AUTH_TOKEN_REQUIRED",
            "Authorization header with a Bearer token is required"
        );
    }

    public static BadRequestException invalidEventType(String type) {
        return new BadRequestException(
            "INVALID_EVENT_TYPE",
            String.format("Unknown organization assignment event type: %s", type)
        );
    }

    public static BadRequestException invalidSyncRequest(String detail) {
        return new BadRequestException(
            "INVALID_SYNC_REQUEST",
            detail
        );
    }
}

package com.example.tenantsync.workflow;

import java.util.List;

/**
 * Failure type names shared by activities and workflows.
 */
public final class SyncErrorTypes {

    public static final String VALIDATION_ERROR = "ValidationError";
    public static final String NOT_FOUND_ERROR = "NotFoundError";
    public static final String UPSTREAM_AUTHENTICATION_ERROR = "UpstreamAuthenticationError";

    /**
     * Never retried: retrying cannot change the outcome.
     */
    public static final List<String> NON_RETRYABLE = List.of(VALIDATION_ERROR, NOT_FOUND_ERROR);

    private SyncErrorTypes() {
    }
}

package com.example.tenantsync.workflow;

import com.example.tenantsync.dto.ErrorInfo;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.failure.ChildWorkflowFailure;
import io.temporal.failure.TemporalFailure;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Turns Temporal failures into serializable {@link ErrorInfo}.
 */
final class WorkflowFailures {

    private static final int MAX_STACK_FRAMES = 15;

    private WorkflowFailures() {
    }

    static ErrorInfo errorInfoOf(Throwable failure) {
        Throwable cause = unwrap(failure);

        String message;
        String type;
        if (cause instanceof ApplicationFailure applicationFailure) {
            message = applicationFailure.getOriginalMessage();
            type = applicationFailure.getType();
        } else if (cause instanceof TemporalFailure temporalFailure) {
            message = temporalFailure.getOriginalMessage();
            type = cause.getClass().getSimpleName();
        } else {
            message = cause.getMessage();
            type = cause.getClass().getName();
        }

        return ErrorInfo.builder()
                .message(message)
                .type(type)
                .stack(stackOf(cause))
                .build();
    }

    static boolean isType(Throwable failure, String type) {
        Throwable cause = unwrap(failure);
        return cause instanceof ApplicationFailure applicationFailure
                && type.equals(applicationFailure.getType());
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ActivityFailure || current instanceof ChildWorkflowFailure)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String stackOf(Throwable cause) {
        return Arrays.stream(cause.getStackTrace())
                .limit(MAX_STACK_FRAMES)
                .map(StackTraceElement::toString)
                .collect(Collectors.joining("\n\tat ", cause.getClass().getName() + "\n\tat ", ""));
    }
}

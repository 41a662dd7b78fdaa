package com.prreview.orchestrator.pipeline;

import java.util.UUID;

/**
 * What happened to one delivery of a review job.
 *
 * errorKind and message are set only for FAILED (message also explains a SKIPPED delivery).
 */
public record TaskOutcome(UUID taskId, Result result, ErrorKind errorKind, String message) {

    public enum Result { COMPLETED, FAILED, SKIPPED }

    public enum ErrorKind {
        VALIDATION,   // bad repository reference
        TRANSPORT,    // GitHub unreachable or returned an error
        UNEXPECTED    // anything else, including store failures
    }

    public static TaskOutcome completed(UUID taskId) {
        return new TaskOutcome(taskId, Result.COMPLETED, null, null);
    }

    public static TaskOutcome failed(UUID taskId, ErrorKind kind, String message) {
        return new TaskOutcome(taskId, Result.FAILED, kind, message);
    }

    public static TaskOutcome skipped(UUID taskId, String reason) {
        return new TaskOutcome(taskId, Result.SKIPPED, null, reason);
    }

    public boolean isFailure() {
        return result == Result.FAILED;
    }
}

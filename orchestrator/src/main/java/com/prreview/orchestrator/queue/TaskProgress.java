package com.prreview.orchestrator.queue;

import java.time.Instant;

/**
 * Live progress of a running task: step {@code current} of {@code total}
 * with a human-readable phase label.
 *
 * A terminal entry is a failure notice left behind by the worker. It is
 * never reported as live progress.
 */
public record TaskProgress(
        int     current,
        int     total,
        String  phase,
        boolean terminal,
        Instant updatedAt
) {
    public static TaskProgress step(int current, int total, String phase) {
        return new TaskProgress(current, total, phase, false, Instant.now());
    }

    public static TaskProgress failed(String message) {
        return new TaskProgress(0, 0, message, true, Instant.now());
    }
}

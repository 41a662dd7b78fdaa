package com.prreview.orchestrator.model;

/**
 * Lifecycle of a ReviewTask.
 *
 * Transitions:
 *   PENDING    → PROCESSING  (claimed by a worker)
 *   PROCESSING → COMPLETED   (all four stages finished)
 *   PROCESSING → FAILED      (fatal error in a stage)
 *
 * A status may also be rewritten with itself (PROCESSING, COMPLETED, FAILED)
 * so that a redelivered job can write the same state again. Nothing ever
 * moves backwards, and PENDING is never re-entered.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING    -> next == PROCESSING;
            case PROCESSING -> next == PROCESSING || next == COMPLETED || next == FAILED;
            case COMPLETED  -> next == COMPLETED;
            case FAILED     -> next == FAILED;
        };
    }
}

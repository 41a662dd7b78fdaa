package com.prreview.orchestrator.service;

import com.prreview.orchestrator.model.TaskStatus;

/** The task exists but is not in the status the operation needs. */
public class InvalidTaskStateException extends RuntimeException {

    private final TaskStatus status;

    public InvalidTaskStateException(String message, TaskStatus status) {
        super(message);
        this.status = status;
    }

    public TaskStatus getStatus() { return status; }
}

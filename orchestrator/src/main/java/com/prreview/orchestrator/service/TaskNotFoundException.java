package com.prreview.orchestrator.service;

import java.util.UUID;

/** No task record exists for the given id. */
public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(UUID taskId) {
        super("Task not found: " + taskId);
    }
}

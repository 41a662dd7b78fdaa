package com.prreview.orchestrator.api.dto;

import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;

import java.util.UUID;

/**
 * Response body for POST /api/v1/analyze.
 * Contains the id the caller polls with.
 */
public record SubmitTaskResponse(UUID taskId, TaskStatus status, String message) {

    public static SubmitTaskResponse from(ReviewTask task) {
        return new SubmitTaskResponse(task.getId(), task.getStatus(), "PR analysis started");
    }
}

package com.prreview.orchestrator.service;

import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/** One row of a task listing. */
public record TaskListItem(
        UUID       taskId,
        TaskStatus status,
        String     repoUrl,
        int        prNumber,
        Instant    createdAt,
        String     prTitle,
        String     author
) {
    public static TaskListItem from(ReviewTask t) {
        return new TaskListItem(
                t.getId(),
                t.getStatus(),
                t.getRepoUrl(),
                t.getPrNumber(),
                t.getCreatedAt(),
                t.getPrTitle(),
                t.getAuthor());
    }
}

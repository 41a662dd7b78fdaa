package com.prreview.orchestrator.service;

import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable task state plus, while PROCESSING, live progress.
 * progress is null whenever no live progress is available.
 */
public record TaskStatusView(
        UUID         taskId,
        TaskStatus   status,
        Instant      createdAt,
        Instant      startedAt,
        Instant      completedAt,
        String       repoUrl,
        int          prNumber,
        String       prTitle,
        String       author,
        Integer      filesCount,
        Integer      additions,
        Integer      deletions,
        ProgressInfo progress,
        String       errorMessage
) {
    public static TaskStatusView from(ReviewTask t, ProgressInfo progress) {
        return new TaskStatusView(
                t.getId(),
                t.getStatus(),
                t.getCreatedAt(),
                t.getStartedAt(),
                t.getCompletedAt(),
                t.getRepoUrl(),
                t.getPrNumber(),
                t.getPrTitle(),
                t.getAuthor(),
                t.getFilesCount(),
                t.getAdditions(),
                t.getDeletions(),
                progress,
                t.getErrorMessage()
        );
    }
}

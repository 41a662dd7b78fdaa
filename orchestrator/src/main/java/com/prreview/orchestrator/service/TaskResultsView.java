package com.prreview.orchestrator.service;

import com.prreview.orchestrator.model.TaskStatus;
import com.prreview.orchestrator.review.ReviewReport;

import java.time.Instant;
import java.util.UUID;

/**
 * Review findings of a COMPLETED task. results is null when the review
 * generator failed; PR metadata lives on the status view.
 */
public record TaskResultsView(UUID taskId, TaskStatus status, Instant completedAt, ReviewReport results) {}

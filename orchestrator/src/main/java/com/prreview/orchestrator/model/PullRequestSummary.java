package com.prreview.orchestrator.model;

/**
 * Derived pull-request metadata stored on a completed task.
 */
public record PullRequestSummary(
        String title,
        String author,
        int    filesCount,
        int    additions,
        int    deletions
) {}

package com.prreview.orchestrator.github;

/**
 * Title, description and author login of a pull request.
 * description may be null when the PR has no body.
 */
public record PullRequestMetadata(String title, String description, String author) {}

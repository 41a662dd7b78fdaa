package com.prreview.orchestrator.github;

/**
 * Thrown when the GitHub API returns an error or is unreachable.
 */
public class GitHubException extends RuntimeException {

    // 0 when no HTTP response was received.
    private final int statusCode;

    public GitHubException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GitHubException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() { return statusCode; }
}

package com.prreview.orchestrator.api.dto;

/**
 * Request body for POST /api/v1/analyze.
 *
 * Required: repoUrl, prNumber
 * Optional: githubToken, for private repositories and higher rate limits.
 *   It is handed to the worker and never stored.
 */
public record SubmitTaskRequest(String repoUrl, Integer prNumber, String githubToken) {

    // Keep the token out of request logging.
    @Override
    public String toString() {
        return "SubmitTaskRequest[repoUrl=" + repoUrl + ", prNumber=" + prNumber
                + ", githubToken=" + (githubToken == null ? "none" : "***") + "]";
    }
}

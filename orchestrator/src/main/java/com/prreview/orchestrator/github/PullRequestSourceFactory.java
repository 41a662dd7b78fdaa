package com.prreview.orchestrator.github;

/**
 * Builds a {@link PullRequestSource} bound to one repository and credential.
 */
public interface PullRequestSourceFactory {

    /**
     * @param repoUrl     repository URL as submitted by the caller
     * @param accessToken optional API token; null for anonymous access
     * @throws InvalidRepositoryException if repoUrl is not a usable repository reference
     */
    PullRequestSource open(String repoUrl, String accessToken);
}

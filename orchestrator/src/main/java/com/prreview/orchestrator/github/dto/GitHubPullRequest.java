package com.prreview.orchestrator.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from GET /repos/{owner}/{repo}/pulls/{number}.
 * Only the fields the review pipeline reads are declared.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubPullRequest(
        String title,
        String body,
        User   user
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String login) {}

    public String authorLogin() {
        return user != null ? user.login() : null;
    }
}

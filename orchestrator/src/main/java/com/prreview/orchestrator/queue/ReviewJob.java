package com.prreview.orchestrator.queue;

import java.util.UUID;

/**
 * An execution request carried by the queue: the task id plus the inputs
 * the pipeline needs. githubToken is optional and never persisted.
 */
public record ReviewJob(UUID taskId, String repoUrl, int prNumber, String githubToken) {

    /** Same job without the credential, as used for redelivery of stored tasks. */
    public static ReviewJob withoutCredential(UUID taskId, String repoUrl, int prNumber) {
        return new ReviewJob(taskId, repoUrl, prNumber, null);
    }

    // Keep the token out of log lines.
    @Override
    public String toString() {
        return "ReviewJob[taskId=" + taskId
                + ", repoUrl=" + repoUrl
                + ", prNumber=" + prNumber
                + ", githubToken=" + (githubToken == null ? "none" : "***") + "]";
    }
}

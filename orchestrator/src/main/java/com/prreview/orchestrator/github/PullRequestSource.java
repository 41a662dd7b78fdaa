package com.prreview.orchestrator.github;

import java.util.List;

/**
 * Read access to the pull requests of one repository.
 *
 * Both calls block on the network and throw {@link GitHubException}
 * on transport, authentication or API errors.
 */
public interface PullRequestSource {

    RepositoryRef repository();

    PullRequestMetadata getMetadata(int prNumber);

    List<ChangedFile> getChangedFiles(int prNumber);
}

package com.prreview.orchestrator.github;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Owner and repository name parsed from a repository URL.
 *
 * Accepts "https://github.com/owner/repo", with or without a trailing
 * slash or ".git" suffix. Anything after the second path segment is ignored.
 */
public record RepositoryRef(String owner, String repo) {

    public static RepositoryRef parse(String repoUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new InvalidRepositoryException("Invalid GitHub repository URL: empty");
        }
        String path;
        try {
            path = new URI(repoUrl.strip()).getPath();
        } catch (URISyntaxException e) {
            throw new InvalidRepositoryException("Invalid GitHub repository URL: " + repoUrl, e);
        }
        if (path == null) {
            throw new InvalidRepositoryException("Invalid GitHub repository URL: " + repoUrl);
        }

        String[] parts = path.replaceAll("^/+|/+$", "").split("/");
        if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new InvalidRepositoryException("Invalid GitHub repository URL: " + repoUrl);
        }
        String repo = parts[1].endsWith(".git")
                ? parts[1].substring(0, parts[1].length() - 4)
                : parts[1];
        if (repo.isBlank()) {
            throw new InvalidRepositoryException("Invalid GitHub repository URL: " + repoUrl);
        }
        return new RepositoryRef(parts[0], repo);
    }

    @Override
    public String toString() {
        return owner + "/" + repo;
    }
}

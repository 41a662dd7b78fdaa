package com.prreview.orchestrator.github;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prreview.orchestrator.github.dto.GitHubFile;
import com.prreview.orchestrator.github.dto.GitHubPullRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * GitHub REST client bound to one repository and (optional) token.
 *
 * Instances are cheap: the underlying java.net.http.HttpClient is shared and
 * owned by {@link GitHubClientFactory}. Calls are blocking, which is fine
 * because they only ever run on a review worker thread.
 */
public class GitHubClient implements PullRequestSource {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    // GitHub's maximum page size for the files endpoint.
    static final int FILES_PER_PAGE = 100;

    // The files endpoint stops at 3000 files (30 pages).
    private static final int MAX_FILE_PAGES = 30;

    private static final TypeReference<List<GitHubFile>> FILE_LIST_TYPE = new TypeReference<>() {};

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final String        apiUrl;
    private final Duration      requestTimeout;
    private final RepositoryRef repository;
    private final String        accessToken;

    GitHubClient(HttpClient http,
                 ObjectMapper json,
                 String apiUrl,
                 Duration requestTimeout,
                 RepositoryRef repository,
                 String accessToken) {
        this.http           = http;
        this.json           = json;
        this.apiUrl         = apiUrl;
        this.requestTimeout = requestTimeout;
        this.repository     = repository;
        this.accessToken    = accessToken;
    }

    @Override
    public RepositoryRef repository() {
        return repository;
    }

    // ------------------------------------------------------------------
    // Pull request data
    // ------------------------------------------------------------------

    @Override
    public PullRequestMetadata getMetadata(int prNumber) {
        String path = pullPath(prNumber);
        log.info("Fetching pull request {}#{}", repository, prNumber);
        String body = get(path, "getMetadata for " + repository + "#" + prNumber);
        try {
            GitHubPullRequest pr = json.readValue(body, GitHubPullRequest.class);
            return new PullRequestMetadata(pr.title(), pr.body(), pr.authorLogin());
        } catch (Exception e) {
            throw new GitHubException("Failed to parse pull request " + repository + "#" + prNumber, e);
        }
    }

    /**
     * List every file in the pull request, following pagination until a
     * short page comes back.
     */
    @Override
    public List<ChangedFile> getChangedFiles(int prNumber) {
        List<ChangedFile> files = new ArrayList<>();
        for (int page = 1; page <= MAX_FILE_PAGES; page++) {
            String path = pullPath(prNumber) + "/files?per_page=" + FILES_PER_PAGE + "&page=" + page;
            String body = get(path, "getChangedFiles for " + repository + "#" + prNumber);

            List<GitHubFile> batch;
            try {
                batch = json.readValue(body, FILE_LIST_TYPE);
            } catch (Exception e) {
                throw new GitHubException("Failed to parse file list for " + repository + "#" + prNumber, e);
            }
            if (batch == null) {
                break;
            }
            for (GitHubFile f : batch) {
                files.add(new ChangedFile(f.filename(), f.additions(), f.deletions(), f.patch()));
            }
            if (batch.size() < FILES_PER_PAGE) {
                break;
            }
        }
        log.info("Pull request {}#{} touches {} files", repository, prNumber, files.size());
        return files;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String pullPath(int prNumber) {
        return "/repos/" + repository.owner() + "/" + repository.repo() + "/pulls/" + prNumber;
    }

    /** GET with the standard GitHub headers; returns the body of a 2xx response. */
    private String get(String path, String opName) {
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl + path))
                    .timeout(requestTimeout)
                    .header("Accept",     "application/vnd.github.v3+json")
                    .header("User-Agent", "AI-Code-Review-System")
                    .GET();
            if (accessToken != null && !accessToken.isBlank()) {
                req.header("Authorization", "token " + accessToken);
            }
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new GitHubException(
                        "GitHub API error: " + opName + " failed: HTTP " + resp.statusCode(),
                        resp.statusCode());
            }
            return resp.body();
        } catch (GitHubException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubException("GitHub API error: " + opName + " interrupted", e);
        } catch (Exception e) {
            throw new GitHubException("GitHub API error: " + opName + " failed: " + e.getMessage(), e);
        }
    }
}

package com.prreview.orchestrator.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates per-task {@link GitHubClient}s that share one HttpClient.
 *
 * The API base URL is configurable so GitHub Enterprise (or a fake server in
 * tests) can be used instead of api.github.com.
 */
@Component
public class GitHubClientFactory implements PullRequestSourceFactory {

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final Duration     requestTimeout;

    public GitHubClientFactory(
            @Value("${review.github.api-url:https://api.github.com}") String apiUrl,
            @Value("${review.github.request-timeout:PT30S}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.apiUrl         = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public PullRequestSource open(String repoUrl, String accessToken) {
        RepositoryRef ref = RepositoryRef.parse(repoUrl);
        return new GitHubClient(http, json, apiUrl, requestTimeout, ref, accessToken);
    }
}

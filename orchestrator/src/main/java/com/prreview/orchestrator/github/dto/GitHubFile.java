package com.prreview.orchestrator.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One element of GET /repos/{owner}/{repo}/pulls/{number}/files.
 * patch is absent for binary files and very large diffs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubFile(
        String filename,
        String status,
        int    additions,
        int    deletions,
        String patch
) {}

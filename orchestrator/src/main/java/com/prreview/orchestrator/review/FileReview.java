package com.prreview.orchestrator.review;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Findings for one file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileReview(String name, List<ReviewIssue> issues) {

    public FileReview {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}

package com.prreview.orchestrator.review;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured output of the review generator: per-file findings plus a summary.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewReport(List<FileReview> files, ReviewSummary summary) {

    public ReviewReport {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Copy of this report whose summary is computed from the files,
     * discarding whatever counts the model reported.
     */
    public ReviewReport withComputedSummary() {
        int totalIssues = files.stream().mapToInt(f -> f.issues().size()).sum();
        int critical = (int) files.stream()
                .flatMap(f -> f.issues().stream())
                .filter(ReviewIssue::isCritical)
                .count();
        return new ReviewReport(files, new ReviewSummary(files.size(), totalIssues, critical));
    }
}

package com.prreview.orchestrator.review;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Aggregate counts over a {@link ReviewReport}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewSummary(int totalFiles, int totalIssues, int criticalIssues) {}

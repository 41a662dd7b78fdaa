package com.prreview.orchestrator.review;

/** Title and description of the pull request as shown to the reviewer. */
public record PrInfo(String title, String description) {}

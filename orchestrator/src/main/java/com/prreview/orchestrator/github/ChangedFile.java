package com.prreview.orchestrator.github;

/**
 * One file touched by a pull request.
 *
 * diffText is the unified diff hunk GitHub reports for the file; it is null
 * for binary files and for diffs too large for the API to return.
 */
public record ChangedFile(String filename, int addedLines, int removedLines, String diffText) {}

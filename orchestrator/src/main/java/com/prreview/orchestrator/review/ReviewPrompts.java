package com.prreview.orchestrator.review;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Prompt text for the pull-request reviewer.
 *
 * The system prompt fixes the output schema; the user message carries the
 * PR description and the diffs as pretty-printed JSON.
 */
public final class ReviewPrompts {

    private ReviewPrompts() {}

    public static final String SYSTEM_PROMPT = """
            You are an expert pull request reviewer. Analyze the PR and code based on the
            following criteria:

              - Code style and formatting issues
              - Potential bugs or errors
              - Performance improvements
              - Best practices

            Analyze every file in the PR and include the review results of all files
            in the output. For each file, identify specific issues with line numbers
            (if available from the diff) and provide concrete suggestions.

            OUTPUT FORMAT: write exactly one JSON object inside <result>...</result>:

            <result>
            {
              "files": [
                {
                  "name": "path/to/File.java",
                  "issues": [
                    {
                      "type": "bug",
                      "line": 42,
                      "description": "clear description of the issue",
                      "suggestion": "actionable suggestion to fix the issue"
                    }
                  ]
                }
              ],
              "summary": { "totalFiles": 1, "totalIssues": 1, "criticalIssues": 1 }
            }
            </result>

            RULES:
              - type must be one of "bug", "style", "performance", "security", "best_practice".
              - line is the line number in the new file, or null when it cannot be identified.
              - "bug" and "security" issues are critical.
              - Include files with no issues with an empty issues array.
              - Do not write anything after </result>.
            """;

    /** First (and only) user message for one review request. */
    public static String userMessage(ReviewInput input, ObjectMapper json) {
        String changes;
        try {
            changes = json.writerWithDefaultPrettyPrinter().writeValueAsString(input.codeChanges());
        } catch (JsonProcessingException e) {
            throw new ReviewGenerationException("Could not serialise code changes", e);
        }
        PrInfo pr = input.prInfo();
        return """
                Please analyze this PR and provide a comprehensive code review in the specified format.

                PR Information:
                Title: %s
                Description: %s

                Files to review: %d files

                Code Changes:
                %s
                """.formatted(
                        orNa(pr.title()),
                        orNa(pr.description()),
                        input.codeChanges().size(),
                        changes);
    }

    private static String orNa(String s) {
        return s == null || s.isBlank() ? "N/A" : s;
    }
}

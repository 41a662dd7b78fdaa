package com.prreview.orchestrator.review;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prreview.orchestrator.claude.ClaudeClient;
import com.prreview.orchestrator.claude.ClaudeClient.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link ReviewGenerator} backed by one Claude Messages API call.
 *
 * The summary block of the returned report is always recomputed from the
 * per-file issues; the model's own counts are not trusted.
 */
@Component
public class ClaudeReviewGenerator implements ReviewGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClaudeReviewGenerator.class);

    private final ClaudeClient claude;
    private final ObjectMapper objectMapper;
    private final String       model;

    public ClaudeReviewGenerator(ClaudeClient claude,
                                 ObjectMapper objectMapper,
                                 @Value("${review.claude.model:claude-sonnet-4-6}") String model) {
        this.claude       = claude;
        this.objectMapper = objectMapper;
        this.model        = model;
    }

    @Override
    public ReviewReport review(ReviewInput input) {
        if (input.codeChanges().isEmpty()) {
            throw new ReviewGenerationException("No code_changes found in the input data.");
        }

        String response;
        try {
            response = claude.complete(
                    model,
                    List.of(new Message("user", ReviewPrompts.userMessage(input, objectMapper))),
                    ReviewPrompts.SYSTEM_PROMPT);
        } catch (ReviewGenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new ReviewGenerationException("Claude API error: " + e.getMessage(), e);
        }

        String json = ResponseParser.extractJson(response)
                .orElseThrow(() -> new ReviewGenerationException("Review response contained no JSON result"));

        ReviewReport report;
        try {
            report = objectMapper.readValue(json, ReviewReport.class);
        } catch (Exception e) {
            throw new ReviewGenerationException("Review response is not a valid report: " + e.getMessage(), e);
        }

        ReviewReport computed = report.withComputedSummary();
        log.info("Review produced {} issues ({} critical) across {} files",
                computed.summary().totalIssues(),
                computed.summary().criticalIssues(),
                computed.summary().totalFiles());
        return computed;
    }
}

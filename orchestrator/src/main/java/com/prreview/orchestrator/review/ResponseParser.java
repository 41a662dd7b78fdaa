package com.prreview.orchestrator.review;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON report out of Claude's text response.
 *
 * The prompt asks for the report inside <result>...</result>. Models
 * sometimes answer with a ```json fence instead, or with bare JSON, so
 * those are accepted as fallbacks in that order.
 */
public class ResponseParser {

    // Matches <result>...</result>
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // Matches ```json ... ``` or ``` ... ```
    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /** Content of the first <result> tag, stripped. */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** Content of the first fenced code block, stripped. */
    public static Optional<String> extractJsonBlock(String response) {
        if (response == null) return Optional.empty();
        Matcher m = JSON_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /**
     * Best-effort JSON payload: result tag, then fenced block, then the
     * response itself when it looks like a JSON object.
     */
    public static Optional<String> extractJson(String response) {
        Optional<String> tagged = extractResult(response);
        if (tagged.isPresent()) {
            return tagged.flatMap(ResponseParser::unwrapFence);
        }
        Optional<String> fenced = extractJsonBlock(response);
        if (fenced.isPresent()) {
            return fenced;
        }
        if (response != null && response.strip().startsWith("{")) {
            return Optional.of(response.strip());
        }
        return Optional.empty();
    }

    // A <result> tag may itself wrap a fenced block.
    private static Optional<String> unwrapFence(String content) {
        return Optional.of(extractJsonBlock(content).orElse(content));
    }
}

package com.prreview.orchestrator.review;

/**
 * Thrown when a review report cannot be produced: empty input,
 * model API failure, or an unparseable response.
 */
public class ReviewGenerationException extends RuntimeException {

    public ReviewGenerationException(String message) {
        super(message);
    }

    public ReviewGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.prreview.orchestrator.review;

/**
 * Produces structured findings for a pull request.
 *
 * Callers treat every exception from {@link #review} as non-fatal.
 */
public interface ReviewGenerator {

    ReviewReport review(ReviewInput input);
}

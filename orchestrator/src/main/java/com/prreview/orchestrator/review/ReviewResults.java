package com.prreview.orchestrator.review;

import java.util.List;

/**
 * The result payload stored on a COMPLETED task.
 *
 * review is null when the generator failed; the gathered PR data is kept
 * either way.
 */
public record ReviewResults(PrInfo prInfo, List<CodeChange> codeChanges, ReviewReport review) {

    public static ReviewResults of(ReviewInput input, ReviewReport review) {
        return new ReviewResults(input.prInfo(), input.codeChanges(), review);
    }
}

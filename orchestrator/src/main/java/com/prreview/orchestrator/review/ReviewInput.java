package com.prreview.orchestrator.review;

import com.prreview.orchestrator.github.ChangedFile;
import com.prreview.orchestrator.github.PullRequestMetadata;

import java.util.List;

/**
 * Everything the review generator sees: the PR description plus one
 * {@link CodeChange} per file, in the order GitHub returned them.
 */
public record ReviewInput(PrInfo prInfo, List<CodeChange> codeChanges) {

    public ReviewInput {
        codeChanges = codeChanges == null ? List.of() : List.copyOf(codeChanges);
    }

    public static ReviewInput of(PullRequestMetadata metadata, List<ChangedFile> files) {
        String title = metadata.title() != null ? metadata.title() : "";
        return new ReviewInput(
                new PrInfo(title, metadata.description()),
                files.stream().map(CodeChange::from).toList());
    }
}

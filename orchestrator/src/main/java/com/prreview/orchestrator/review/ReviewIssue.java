package com.prreview.orchestrator.review;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Set;

/**
 * A single finding in a reviewed file.
 *
 * type is one of bug, style, performance, security, best_practice.
 * line is null when the finding cannot be tied to a diff line.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewIssue(String type, Integer line, String description, String suggestion) {

    private static final Set<String> CRITICAL_TYPES = Set.of("bug", "security");

    @JsonIgnore
    public boolean isCritical() {
        return type != null && CRITICAL_TYPES.contains(type);
    }
}

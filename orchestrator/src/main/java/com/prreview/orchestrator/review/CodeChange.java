package com.prreview.orchestrator.review;

import com.prreview.orchestrator.github.ChangedFile;

/**
 * One changed file in the normalized review input.
 *
 * language is the file extension ("py", "java", ...) or "unknown";
 * diff is never null.
 */
public record CodeChange(String filename, String language, String diff) {

    public static final String UNKNOWN_LANGUAGE = "unknown";

    public static CodeChange from(ChangedFile file) {
        String diff = file.diffText() != null ? file.diffText() : "";
        return new CodeChange(file.filename(), languageOf(file.filename()), diff);
    }

    /**
     * Infer the language label from the file extension.
     * Only the last path segment is considered, so "docs.v2/Makefile" has none.
     */
    public static String languageOf(String filename) {
        if (filename == null) {
            return UNKNOWN_LANGUAGE;
        }
        String name = filename.substring(filename.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return UNKNOWN_LANGUAGE;
        }
        return name.substring(dot + 1);
    }
}

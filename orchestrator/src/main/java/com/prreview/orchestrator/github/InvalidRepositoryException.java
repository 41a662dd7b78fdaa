package com.prreview.orchestrator.github;

/**
 * Thrown when a repository URL cannot be turned into an owner/repo pair.
 */
public class InvalidRepositoryException extends IllegalArgumentException {

    public InvalidRepositoryException(String message) {
        super(message);
    }

    public InvalidRepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}

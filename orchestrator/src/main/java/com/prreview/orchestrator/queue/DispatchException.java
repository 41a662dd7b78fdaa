package com.prreview.orchestrator.queue;

/**
 * Thrown when a job cannot be enqueued (queue full or shut down).
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

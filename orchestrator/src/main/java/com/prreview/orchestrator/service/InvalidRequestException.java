package com.prreview.orchestrator.service;

/** Caller input that fails validation (submission fields, paging parameters). */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}

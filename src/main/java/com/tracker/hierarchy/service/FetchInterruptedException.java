package com.tracker.hierarchy.service;

/**
 * The extracting thread was interrupted while talking to the source. Aborts the build.
 */
public class FetchInterruptedException extends RuntimeException {

    public FetchInterruptedException(String message) {
        super(message);
    }

    public FetchInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}

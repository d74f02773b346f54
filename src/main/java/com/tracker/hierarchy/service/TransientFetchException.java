package com.tracker.hierarchy.service;

/**
 * A non-root fetch failed. The engine treats the affected container as childless.
 */
public class TransientFetchException extends RuntimeException {

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.ContainerLocator;

/**
 * The declared root could not be fetched or is not part of the fetched scope.
 * This is the only condition that aborts a build.
 */
public class RootNotFoundException extends RuntimeException {

    private final ContainerLocator root;

    public RootNotFoundException(ContainerLocator root, String message) {
        super(message);
        this.root = root;
    }

    public RootNotFoundException(ContainerLocator root, String message, Throwable cause) {
        super(message, cause);
        this.root = root;
    }

    public ContainerLocator getRoot() {
        return root;
    }
}

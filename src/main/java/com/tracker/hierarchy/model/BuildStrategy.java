package com.tracker.hierarchy.model;

/**
 * How parent/child edges between containers are discovered.
 */
public enum BuildStrategy {
    /** Ask the source for the children of each container, level by level. */
    TRAVERSAL,
    /** Fetch every container of the scope once and link them by parent pointer in memory. */
    BATCH
}

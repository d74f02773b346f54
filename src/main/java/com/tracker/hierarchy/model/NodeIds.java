package com.tracker.hierarchy.model;

/**
 * Composite identifier scheme shared by the source and the engine.
 */
public final class NodeIds {

    private static final String CONTAINER_PREFIX = "epic:";
    private static final String LEAF_PREFIX = "issue:";

    private NodeIds() {
    }

    public static String containerId(long groupId, long iid) {
        return CONTAINER_PREFIX + groupId + "#" + iid;
    }

    public static String leafId(long projectId, long iid) {
        return LEAF_PREFIX + projectId + "#" + iid;
    }
}

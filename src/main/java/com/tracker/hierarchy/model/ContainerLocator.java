package com.tracker.hierarchy.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Externally addressable handle of a container: the owning group and the container's
 * group-local number.
 */
@Getter
@EqualsAndHashCode
public class ContainerLocator {
    private final long groupId;
    private final long iid;

    public ContainerLocator(long groupId, long iid) {
        this.groupId = groupId;
        this.iid = iid;
    }

    public static ContainerLocator of(FetchedNode container) {
        return new ContainerLocator(container.getGroupId(), container.getIid());
    }

    /**
     * Composite id the source assigns to the container this locator points at.
     */
    public String toNodeId() {
        return NodeIds.containerId(groupId, iid);
    }

    @Override
    public String toString() {
        return toNodeId();
    }
}

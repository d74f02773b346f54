package com.tracker.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Getter;

/**
 * A fetched node with its position in the tree fixed by one of the construction strategies.
 */
@Getter
public class PlacedNode {
    @JsonUnwrapped
    private final FetchedNode node;

    private final String parentId;
    private final NodeType parentType;
    private final String rootId;
    private final int depth;
    private final String hierarchyPath;

    private PlacedNode(FetchedNode node, String parentId, NodeType parentType,
                       String rootId, int depth, String hierarchyPath) {
        this.node = node;
        this.parentId = parentId;
        this.parentType = parentType;
        this.rootId = rootId;
        this.depth = depth;
        this.hierarchyPath = hierarchyPath;
    }

    public static PlacedNode root(FetchedNode node) {
        return new PlacedNode(node, null, null, node.getId(), 0, node.getId());
    }

    public static PlacedNode childOf(PlacedNode parent, FetchedNode node) {
        return new PlacedNode(
                node,
                parent.getId(),
                parent.getNode().getType(),
                parent.getRootId(),
                parent.getDepth() + 1,
                parent.getHierarchyPath() + "/" + node.getId());
    }

    @JsonIgnore
    public String getId() {
        return node.getId();
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }
}

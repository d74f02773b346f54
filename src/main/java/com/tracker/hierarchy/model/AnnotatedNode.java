package com.tracker.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Getter;

/**
 * A placed node plus the structural counts computed over the finished node set.
 */
@Getter
public class AnnotatedNode {
    @JsonUnwrapped
    private final PlacedNode placed;

    private final int childCount;
    private final int descendantCount;
    private final boolean leaf;
    private final int siblingPosition;

    public AnnotatedNode(PlacedNode placed, int childCount, int descendantCount, int siblingPosition) {
        this.placed = placed;
        this.childCount = childCount;
        this.descendantCount = descendantCount;
        this.leaf = childCount == 0;
        this.siblingPosition = siblingPosition;
    }

    @JsonIgnore
    public String getId() {
        return placed.getId();
    }

    @JsonIgnore
    public FetchedNode getNode() {
        return placed.getNode();
    }
}

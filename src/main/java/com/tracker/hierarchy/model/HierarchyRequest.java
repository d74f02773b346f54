package com.tracker.hierarchy.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Extraction request. Unset optional fields fall back to the {@code hierarchy.*} configuration.
 */
@Getter
@Setter
public class HierarchyRequest {
    private long rootGroupId;
    private long rootIid;
    private Integer maxDepth;
    private Boolean includeClosed;
    private BuildStrategy strategy;

    /** Groups fetched up front by the batch strategy. */
    private List<Long> scopeGroupIds = new ArrayList<>();

    public ContainerLocator rootLocator() {
        return new ContainerLocator(rootGroupId, rootIid);
    }
}

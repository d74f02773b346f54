package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.FetchedNode;

import java.util.List;

/**
 * Edge discovery used by {@link HierarchyPlacer}: the candidate child containers of one container.
 * Candidates may include nodes already placed; the placer filters them.
 */
@FunctionalInterface
public interface ChildDiscovery {

    List<FetchedNode> childrenOf(FetchedNode container);
}

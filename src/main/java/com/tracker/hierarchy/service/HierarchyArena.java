package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.BuildReport;
import com.tracker.hierarchy.model.PlacedNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-build arena: the growing node list, the id index that doubles as the visited set,
 * and the counters of recovered conditions.
 *
 * <p>One arena belongs to exactly one build and is passed explicitly through every
 * placement step. It is not thread-safe.
 */
public class HierarchyArena {

    private final List<PlacedNode> nodes = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();

    private int cyclesSkipped;
    private int duplicatesSkipped;
    private int truncatedContainers;
    private int fetchFailures;
    private int closedLeavesExcluded;

    public boolean isVisited(String id) {
        return indexById.containsKey(id);
    }

    public void add(PlacedNode node) {
        if (isVisited(node.getId())) {
            throw new IllegalStateException("Node already placed: " + node.getId());
        }
        indexById.put(node.getId(), nodes.size());
        nodes.add(node);
    }

    public PlacedNode get(String id) {
        Integer index = indexById.get(id);
        return index != null ? nodes.get(index) : null;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Containers placed so far, in placement order.
     */
    public List<PlacedNode> containers() {
        List<PlacedNode> containers = new ArrayList<>();
        for (PlacedNode node : nodes) {
            if (node.getNode().isContainer()) {
                containers.add(node);
            }
        }
        return containers;
    }

    public List<PlacedNode> getNodes() {
        return new ArrayList<>(nodes);
    }

    void recordCycle() {
        cyclesSkipped++;
    }

    void recordDuplicate() {
        duplicatesSkipped++;
    }

    void recordTruncation() {
        truncatedContainers++;
    }

    void recordFetchFailure() {
        fetchFailures++;
    }

    void recordClosedExcluded() {
        closedLeavesExcluded++;
    }

    public BuildReport toReport() {
        return new BuildReport(cyclesSkipped, duplicatesSkipped, truncatedContainers,
                fetchFailures, closedLeavesExcluded, 0);
    }
}

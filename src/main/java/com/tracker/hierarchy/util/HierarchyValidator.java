package com.tracker.hierarchy.util;

import com.tracker.hierarchy.model.FinalNode;
import com.tracker.hierarchy.model.PlacedNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Consistency check of a finished build.
 *
 * Checks:
 * 1. Exactly one root (depth 0, no parent) and unique ids
 * 2. depth = parent depth + 1, path = parent path + "/" + id, same rootId everywhere
 * 3. childCount and descendantCount match the parent links
 * 4. completionPct set only for nodes with children, within [0, 100]
 *
 * Violations are reported, never repaired.
 */
@Slf4j
public class HierarchyValidator {

    private HierarchyValidator() {
    }

    /**
     * @param nodes finished nodes of one build
     * @return human readable violations, empty when the build is consistent
     */
    public static List<String> validate(List<FinalNode> nodes) {
        List<String> violations = new ArrayList<>();
        if (nodes == null || nodes.isEmpty()) {
            violations.add("empty build");
            return violations;
        }

        Map<String, FinalNode> byId = new HashMap<>();
        String rootId = null;
        for (FinalNode node : nodes) {
            if (byId.put(node.getId(), node) != null) {
                violations.add("duplicate id " + node.getId());
            }
            if (node.getPlaced().getDepth() == 0) {
                if (rootId != null) {
                    violations.add("second root " + node.getId() + " next to " + rootId);
                }
                rootId = node.getId();
            }
        }
        if (rootId == null) {
            violations.add("no node at depth 0");
        }

        Map<String, Integer> childCounts = new HashMap<>();
        Map<String, Integer> childDescendantSums = new HashMap<>();
        for (FinalNode node : nodes) {
            checkPlacement(node, byId, rootId, violations);

            String parentId = node.getPlaced().getParentId();
            if (parentId != null) {
                childCounts.merge(parentId, 1, Integer::sum);
                childDescendantSums.merge(parentId, node.getAnnotated().getDescendantCount(), Integer::sum);
            }
        }

        for (FinalNode node : nodes) {
            checkCounts(node, childCounts, childDescendantSums, violations);
        }

        if (violations.isEmpty()) {
            log.debug("[Validate] {} node(s) consistent", nodes.size());
        } else {
            log.warn("[Validate] {} violation(s) in {} node(s), first: {}",
                    violations.size(), nodes.size(), violations.get(0));
        }
        return violations;
    }

    private static void checkPlacement(FinalNode node, Map<String, FinalNode> byId, String rootId,
                                       List<String> violations) {
        PlacedNode placed = node.getPlaced();

        if (rootId != null && !rootId.equals(placed.getRootId())) {
            violations.add(node.getId() + ": rootId " + placed.getRootId() + " != " + rootId);
        }

        if (placed.getParentId() == null) {
            if (placed.getDepth() != 0) {
                violations.add(node.getId() + ": no parent but depth " + placed.getDepth());
            }
            if (!node.getId().equals(placed.getHierarchyPath())) {
                violations.add(node.getId() + ": root path " + placed.getHierarchyPath());
            }
            return;
        }

        FinalNode parent = byId.get(placed.getParentId());
        if (parent == null) {
            violations.add(node.getId() + ": parent " + placed.getParentId() + " missing");
            return;
        }
        PlacedNode parentPlaced = parent.getPlaced();
        if (placed.getDepth() != parentPlaced.getDepth() + 1) {
            violations.add(node.getId() + ": depth " + placed.getDepth()
                    + " under parent depth " + parentPlaced.getDepth());
        }
        String expectedPath = parentPlaced.getHierarchyPath() + "/" + node.getId();
        if (!expectedPath.equals(placed.getHierarchyPath())) {
            violations.add(node.getId() + ": path " + placed.getHierarchyPath() + " != " + expectedPath);
        }
    }

    private static void checkCounts(FinalNode node, Map<String, Integer> childCounts,
                                    Map<String, Integer> childDescendantSums, List<String> violations) {
        int children = childCounts.getOrDefault(node.getId(), 0);
        int expectedDescendants = children + childDescendantSums.getOrDefault(node.getId(), 0);

        if (node.getAnnotated().getChildCount() != children) {
            violations.add(node.getId() + ": childCount " + node.getAnnotated().getChildCount() + " != " + children);
        }
        if (node.getAnnotated().getDescendantCount() != expectedDescendants) {
            violations.add(node.getId() + ": descendantCount " + node.getAnnotated().getDescendantCount()
                    + " != " + expectedDescendants);
        }

        Double pct = node.getCompletionPct();
        if (children == 0 && pct != null) {
            violations.add(node.getId() + ": completionPct set without children");
        }
        if (children > 0 && (pct == null || pct < 0.0 || pct > 100.0)) {
            violations.add(node.getId() + ": completionPct " + pct + " out of range");
        }
    }
}

package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.AnnotatedNode;
import com.tracker.hierarchy.model.PlacedNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural annotations over a finished node set: child and descendant counts, leaf flag
 * and 1-based sibling position in assembly order.
 *
 * A node whose parent is not in the set is counted as parentless.
 */
@Slf4j
public class RelationshipCalculator {

    public List<AnnotatedNode> annotate(List<PlacedNode> nodes) {
        log.info("[Relationships] annotating {} node(s)", nodes.size());

        Map<String, List<String>> childrenByParent = indexChildren(nodes);
        Map<String, Integer> descendantCounts = countDescendants(nodes, childrenByParent);
        Map<String, Integer> siblingPositions = siblingPositions(childrenByParent);

        List<AnnotatedNode> annotated = new ArrayList<>(nodes.size());
        for (PlacedNode node : nodes) {
            List<String> children = childrenByParent.getOrDefault(node.getId(), Collections.emptyList());
            annotated.add(new AnnotatedNode(
                    node,
                    children.size(),
                    descendantCounts.get(node.getId()),
                    siblingPositions.getOrDefault(node.getId(), 1)));
        }

        log.info("[Relationships] done: {} parent(s)", childrenByParent.size());
        return annotated;
    }

    /**
     * parentId -> child ids in assembly order; parents missing from the set are dropped.
     */
    private Map<String, List<String>> indexChildren(List<PlacedNode> nodes) {
        Set<String> presentIds = new HashSet<>();
        for (PlacedNode node : nodes) {
            presentIds.add(node.getId());
        }

        Map<String, List<String>> childrenByParent = new LinkedHashMap<>();
        int missingParents = 0;
        for (PlacedNode node : nodes) {
            String parentId = node.getParentId();
            if (parentId == null) {
                continue;
            }
            if (!presentIds.contains(parentId)) {
                missingParents++;
                log.warn("[Relationships] parent {} of {} is not in the node set, counted as parentless",
                        parentId, node.getId());
                continue;
            }
            childrenByParent.computeIfAbsent(parentId, k -> new ArrayList<>()).add(node.getId());
        }
        if (missingParents > 0) {
            log.warn("[Relationships] {} node(s) reference a missing parent", missingParents);
        }
        return childrenByParent;
    }

    /**
     * Deepest nodes first, so every child's count exists before its parent needs it.
     */
    private Map<String, Integer> countDescendants(List<PlacedNode> nodes, Map<String, List<String>> childrenByParent) {
        List<PlacedNode> deepestFirst = new ArrayList<>(nodes);
        deepestFirst.sort(Comparator.comparingInt(PlacedNode::getDepth).reversed());

        Map<String, Integer> counts = new HashMap<>();
        for (PlacedNode node : deepestFirst) {
            List<String> children = childrenByParent.getOrDefault(node.getId(), Collections.emptyList());
            int count = children.size();
            for (String childId : children) {
                count += counts.getOrDefault(childId, 0);
            }
            counts.put(node.getId(), count);
        }
        return counts;
    }

    private Map<String, Integer> siblingPositions(Map<String, List<String>> childrenByParent) {
        Map<String, Integer> positions = new HashMap<>();
        for (List<String> siblings : childrenByParent.values()) {
            for (int i = 0; i < siblings.size(); i++) {
                positions.put(siblings.get(i), i + 1);
            }
        }
        return positions;
    }
}

package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.FinalNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sink that keeps the latest build of every tree in memory.
 */
@Slf4j
@Component
public class InMemoryHierarchySink implements HierarchySink {

    /** rootId -> (node id -> node) */
    private final Map<String, Map<String, FinalNode>> treesByRoot = new HashMap<>();

    @Override
    public synchronized void upsert(FinalNode node) {
        if (node == null || node.getId() == null) {
            return;
        }
        treesByRoot.computeIfAbsent(node.getPlaced().getRootId(), k -> new LinkedHashMap<>())
                .put(node.getId(), node);
    }

    @Override
    public synchronized void upsertBatch(List<FinalNode> nodes) {
        if (nodes == null) {
            return;
        }

        Map<String, Map<String, FinalNode>> incoming = new LinkedHashMap<>();
        for (FinalNode node : nodes) {
            if (node == null || node.getId() == null) {
                continue;
            }
            incoming.computeIfAbsent(node.getPlaced().getRootId(), k -> new LinkedHashMap<>())
                    .put(node.getId(), node);
        }

        for (Map.Entry<String, Map<String, FinalNode>> tree : incoming.entrySet()) {
            Map<String, FinalNode> previous = treesByRoot.put(tree.getKey(), tree.getValue());
            int dropped = 0;
            if (previous != null) {
                for (String id : previous.keySet()) {
                    if (!tree.getValue().containsKey(id)) {
                        dropped++;
                    }
                }
            }
            log.info("[Sink] stored tree {}: {} node(s), {} dropped from the previous build",
                    tree.getKey(), tree.getValue().size(), dropped);
        }
    }

    @Override
    public synchronized List<FinalNode> findByRoot(String rootId) {
        Map<String, FinalNode> tree = treesByRoot.get(rootId);
        return tree != null ? new ArrayList<>(tree.values()) : new ArrayList<>();
    }
}

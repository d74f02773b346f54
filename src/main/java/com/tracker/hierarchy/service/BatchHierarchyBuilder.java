package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.BuildResult;
import com.tracker.hierarchy.model.ContainerLocator;
import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.model.PlacedNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one tree from a pre-fetched scope of containers, linking them through
 * {@code parentInternalId} in memory instead of trusting the source's parent filter.
 *
 * Containers of the scope that cannot be reached from the root are left out and reported
 * as orphaned. Leaf items are still fetched per container.
 */
@Slf4j
public class BatchHierarchyBuilder {

    private final HierarchyPlacer placer;

    public BatchHierarchyBuilder(HierarchySource source) {
        this.placer = new HierarchyPlacer(source);
    }

    /**
     * @param allContainers every container of the scope
     * @param rootLocator   root container, must be part of {@code allContainers}
     * @param maxDepth      deepest depth any output node may have
     * @param includeClosed whether closed leaf items are kept
     * @return placed nodes, root first, with the orphan count in the report
     * @throws RootNotFoundException if the root is not in the scope
     */
    public BuildResult build(List<FetchedNode> allContainers, ContainerLocator rootLocator,
                             int maxDepth, boolean includeClosed) {
        List<FetchedNode> scope = allContainers != null ? allContainers : Collections.emptyList();
        log.info("[Batch] building from {} over {} fetched container(s): maxDepth={}, includeClosed={}",
                rootLocator, scope.size(), maxDepth, includeClosed);

        ScopeIndex index = new ScopeIndex(scope);

        FetchedNode root = index.byId.get(rootLocator.toNodeId());
        if (root == null) {
            log.error("[Batch] root {} is not in the fetched scope ({} container(s))", rootLocator, index.byId.size());
            throw new RootNotFoundException(rootLocator,
                    "Root " + rootLocator + " not found in fetched scope; the scope is too narrow");
        }

        HierarchyArena arena = placer.place(root, index::childrenOf, maxDepth, includeClosed);
        List<PlacedNode> nodes = arena.getNodes();

        int orphaned = index.countUnreachableFrom(root);
        if (orphaned > 0) {
            log.warn("[Batch] {} container(s) in scope are not reachable from {}", orphaned, root.getId());
        }

        BuildResult result = new BuildResult(nodes, arena.toReport().withOrphanedContainers(orphaned));
        log.info("[Batch] built {} node(s) under {}: {}", nodes.size(), root.getId(), result.getReport());
        return result;
    }

    /**
     * In-memory view of the scope: containers by id and by parent internal id.
     */
    private static final class ScopeIndex {
        private final Map<String, FetchedNode> byId = new LinkedHashMap<>();
        private final Map<Long, List<FetchedNode>> byParentInternalId = new LinkedHashMap<>();

        private ScopeIndex(List<FetchedNode> containers) {
            for (FetchedNode container : containers) {
                if (container == null || container.getId() == null || !container.isContainer()) {
                    continue;
                }
                // a group fetched twice yields the same container twice; keep the first copy
                if (byId.putIfAbsent(container.getId(), container) != null) {
                    continue;
                }
                if (container.getParentInternalId() != null) {
                    byParentInternalId
                            .computeIfAbsent(container.getParentInternalId(), k -> new ArrayList<>())
                            .add(container);
                }
            }
            log.debug("[Batch] indexed {} container(s), {} distinct parent(s)",
                    byId.size(), byParentInternalId.size());
        }

        private List<FetchedNode> childrenOf(FetchedNode container) {
            return byParentInternalId.getOrDefault(container.getInternalId(), Collections.emptyList());
        }

        /**
         * Containers with no parent-pointer path to the root, regardless of depth limits.
         */
        private int countUnreachableFrom(FetchedNode root) {
            Set<String> reachable = new HashSet<>();
            Deque<FetchedNode> queue = new ArrayDeque<>();
            queue.add(root);
            reachable.add(root.getId());

            while (!queue.isEmpty()) {
                for (FetchedNode child : childrenOf(queue.poll())) {
                    if (reachable.add(child.getId())) {
                        queue.add(child);
                    }
                }
            }
            return byId.size() - reachable.size();
        }
    }
}

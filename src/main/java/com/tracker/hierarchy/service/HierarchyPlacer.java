package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.model.PlacedNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Placement routine shared by both construction strategies.
 *
 * Steps:
 * 1. Place the root at depth 0
 * 2. Depth-first over containers with an explicit stack, asking {@link ChildDiscovery} for
 *    the candidates of each container; an id that is already placed is a cycle and is skipped
 * 3. Containers at {@code maxDepth} are not expanded
 * 4. Attach leaf items one level below every placed container, in placement order
 *
 * The strategies differ only in the {@link ChildDiscovery} they pass in. Fetch failures
 * are absorbed per container; an interrupted fetch aborts the whole build.
 */
@Slf4j
public class HierarchyPlacer {

    private final HierarchySource source;

    public HierarchyPlacer(HierarchySource source) {
        this.source = source;
    }

    /**
     * Assemble the tree under {@code root}.
     *
     * @param root          the already fetched root container
     * @param discovery     how child containers are found
     * @param maxDepth      deepest depth any output node may have
     * @param includeClosed whether closed leaf items are kept
     * @return the arena holding the placed nodes and the counters
     */
    public HierarchyArena place(FetchedNode root, ChildDiscovery discovery, int maxDepth, boolean includeClosed) {
        HierarchyArena arena = new HierarchyArena();

        placeContainers(arena, root, discovery, maxDepth);
        int containerCount = arena.size();
        log.info("[Placement] containers placed: {}", containerCount);

        attachLeafItems(arena, maxDepth, includeClosed);
        log.info("[Placement] leaf items placed: {}", arena.size() - containerCount);

        return arena;
    }

    private void placeContainers(HierarchyArena arena, FetchedNode root, ChildDiscovery discovery, int maxDepth) {
        Deque<PlacementTask> stack = new ArrayDeque<>();
        stack.push(new PlacementTask(null, root));

        while (!stack.isEmpty()) {
            PlacementTask task = stack.pop();
            FetchedNode candidate = task.node;

            if (arena.isVisited(candidate.getId())) {
                arena.recordCycle();
                log.warn("[Placement] cycle detected: {} is already placed, skipped under parent {}",
                        candidate.getId(), task.parent != null ? task.parent.getId() : null);
                continue;
            }

            PlacedNode placed = task.parent == null
                    ? PlacedNode.root(candidate)
                    : PlacedNode.childOf(task.parent, candidate);
            arena.add(placed);
            log.debug("[Placement] placed container {} at depth {}", placed.getId(), placed.getDepth());

            if (placed.getDepth() >= maxDepth) {
                arena.recordTruncation();
                log.warn("[Placement] max depth {} reached at {}, subtree not expanded",
                        maxDepth, placed.getId());
                continue;
            }

            List<FetchedNode> children = discoverChildren(arena, discovery, placed);

            // reversed so siblings come off the stack in discovery order
            for (int i = children.size() - 1; i >= 0; i--) {
                FetchedNode child = children.get(i);
                if (child == null || !child.isContainer()) {
                    continue;
                }
                stack.push(new PlacementTask(placed, child));
            }
        }
    }

    private List<FetchedNode> discoverChildren(HierarchyArena arena, ChildDiscovery discovery, PlacedNode parent) {
        try {
            List<FetchedNode> children = discovery.childrenOf(parent.getNode());
            return children != null ? children : Collections.emptyList();
        } catch (RootNotFoundException | FetchInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            arena.recordFetchFailure();
            log.warn("[Placement] child fetch failed for {}, treated as childless: {}",
                    parent.getId(), e.getMessage());
            return Collections.emptyList();
        }
    }

    private void attachLeafItems(HierarchyArena arena, int maxDepth, boolean includeClosed) {
        for (PlacedNode container : arena.containers()) {
            if (container.getDepth() >= maxDepth) {
                // already counted as truncated while placing containers
                continue;
            }

            List<FetchedNode> leafItems = fetchLeafItems(arena, container);
            log.debug("[Placement] {} leaf item(s) under {}", leafItems.size(), container.getId());

            for (FetchedNode leaf : leafItems) {
                if (leaf == null) {
                    continue;
                }
                if (!includeClosed && leaf.isClosed()) {
                    arena.recordClosedExcluded();
                    continue;
                }
                if (arena.isVisited(leaf.getId())) {
                    arena.recordDuplicate();
                    log.warn("[Placement] {} already attached to {}, skipped under {}",
                            leaf.getId(), arena.get(leaf.getId()).getParentId(), container.getId());
                    continue;
                }
                arena.add(PlacedNode.childOf(container, leaf));
            }
        }
    }

    private List<FetchedNode> fetchLeafItems(HierarchyArena arena, PlacedNode container) {
        try {
            List<FetchedNode> leafItems = source.getLeafItems(container.getNode());
            return leafItems != null ? leafItems : Collections.emptyList();
        } catch (FetchInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            arena.recordFetchFailure();
            log.warn("[Placement] leaf item fetch failed for {}, treated as having none: {}",
                    container.getId(), e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * One pending placement: a candidate node and the already placed parent it hangs under.
     */
    private static final class PlacementTask {
        private final PlacedNode parent;
        private final FetchedNode node;

        private PlacementTask(PlacedNode parent, FetchedNode node) {
            this.parent = parent;
            this.node = node;
        }
    }
}

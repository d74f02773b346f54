package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.BuildResult;
import com.tracker.hierarchy.model.ContainerLocator;
import com.tracker.hierarchy.model.FetchedNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds one tree by asking the source for the children of every container, one level at a time.
 * Suited to small or targeted pulls; relies on the source's server-side parent filter.
 */
@Slf4j
public class TraversalHierarchyBuilder {

    private final HierarchySource source;
    private final HierarchyPlacer placer;

    public TraversalHierarchyBuilder(HierarchySource source) {
        this.source = source;
        this.placer = new HierarchyPlacer(source);
    }

    /**
     * @param rootLocator   root container
     * @param maxDepth      deepest depth any output node may have
     * @param includeClosed whether closed leaf items are kept
     * @return placed nodes, root first
     * @throws RootNotFoundException if the root cannot be fetched
     */
    public BuildResult build(ContainerLocator rootLocator, int maxDepth, boolean includeClosed) {
        log.info("[Traversal] building from {}: maxDepth={}, includeClosed={}",
                rootLocator, maxDepth, includeClosed);

        FetchedNode root = fetchRoot(rootLocator);
        log.info("[Traversal] root: {} ({})", root.getId(), root.getTitle());

        HierarchyArena arena = placer.place(root, source::getChildren, maxDepth, includeClosed);
        BuildResult result = new BuildResult(arena.getNodes(), arena.toReport());

        log.info("[Traversal] built {} node(s) under {}: {}",
                result.getNodes().size(), root.getId(), result.getReport());
        return result;
    }

    private FetchedNode fetchRoot(ContainerLocator rootLocator) {
        FetchedNode root;
        try {
            root = source.getRoot(rootLocator);
        } catch (RootNotFoundException e) {
            log.error("[Traversal] root {} not found: {}", rootLocator, e.getMessage());
            throw e;
        } catch (FetchInterruptedException e) {
            log.error("[Traversal] interrupted while fetching root {}", rootLocator);
            throw e;
        } catch (RuntimeException e) {
            log.error("[Traversal] failed to fetch root {}: {}", rootLocator, e.getMessage());
            throw new RootNotFoundException(rootLocator, "Failed to fetch root " + rootLocator, e);
        }
        if (root == null) {
            log.error("[Traversal] source returned no root for {}", rootLocator);
            throw new RootNotFoundException(rootLocator, "Root " + rootLocator + " not found");
        }
        return root;
    }
}

package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.FinalNode;

import java.util.List;

/**
 * Write side for finished nodes. Nodes are stored per tree and keyed by
 * {@code (rootId, id)}, so the same epic may appear in several trees.
 * The engine never calls this; the extraction service does once a build is complete.
 */
public interface HierarchySink {

    /**
     * Insert or replace one node of its tree.
     */
    void upsert(FinalNode node);

    /**
     * Store a complete build. Every tree present in {@code nodes} replaces the stored
     * version of that tree, including nodes the new build no longer contains.
     */
    void upsertBatch(List<FinalNode> nodes);

    /**
     * Stored nodes of one tree, in assembly order.
     */
    List<FinalNode> findByRoot(String rootId);
}

package com.tracker.hierarchy.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Output of one construction strategy: the placed nodes in assembly order and the report.
 */
@Getter
public class BuildResult {
    private final List<PlacedNode> nodes;
    private final BuildReport report;

    public BuildResult(List<PlacedNode> nodes, BuildReport report) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.report = report;
    }

    public PlacedNode getRoot() {
        return nodes.get(0);
    }

    public BuildResult withReport(BuildReport report) {
        return new BuildResult(nodes, report);
    }
}

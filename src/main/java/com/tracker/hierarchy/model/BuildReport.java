package com.tracker.hierarchy.model;

import lombok.Getter;

/**
 * Counts of every condition a build absorbed instead of failing.
 */
@Getter
public class BuildReport {
    private final int cyclesSkipped;
    private final int duplicatesSkipped;
    private final int truncatedContainers;
    private final int fetchFailures;
    private final int closedLeavesExcluded;
    private final int orphanedContainers;

    public BuildReport(int cyclesSkipped, int duplicatesSkipped, int truncatedContainers,
                       int fetchFailures, int closedLeavesExcluded, int orphanedContainers) {
        this.cyclesSkipped = cyclesSkipped;
        this.duplicatesSkipped = duplicatesSkipped;
        this.truncatedContainers = truncatedContainers;
        this.fetchFailures = fetchFailures;
        this.closedLeavesExcluded = closedLeavesExcluded;
        this.orphanedContainers = orphanedContainers;
    }

    public BuildReport withOrphanedContainers(int orphaned) {
        return new BuildReport(cyclesSkipped, duplicatesSkipped, truncatedContainers,
                fetchFailures, closedLeavesExcluded, orphaned);
    }

    @Override
    public String toString() {
        return "BuildReport{cycles=" + cyclesSkipped
                + ", duplicates=" + duplicatesSkipped
                + ", truncated=" + truncatedContainers
                + ", fetchFailures=" + fetchFailures
                + ", closedExcluded=" + closedLeavesExcluded
                + ", orphaned=" + orphanedContainers + "}";
    }
}

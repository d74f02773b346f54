package com.tracker.hierarchy.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Statistics of one finished extraction.
 */
@Getter
@Setter
public class ExtractionSummary {
    private String rootId;
    private BuildStrategy strategy;
    private int totalItems;
    private int containerCount;
    private int leafItemCount;
    private int openCount;
    private int closedCount;
    private int maxDepth;
    private double avgDepth;
    private int leafNodeCount;
    private int violationCount;
    private BuildReport report;
    private long executionTimeMs;
}

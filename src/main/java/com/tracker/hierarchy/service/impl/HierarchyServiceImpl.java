package com.tracker.hierarchy.service.impl;

import com.tracker.hierarchy.config.HierarchyConfig;
import com.tracker.hierarchy.model.AnnotatedNode;
import com.tracker.hierarchy.model.BuildResult;
import com.tracker.hierarchy.model.BuildStrategy;
import com.tracker.hierarchy.model.ContainerLocator;
import com.tracker.hierarchy.model.ExtractionSummary;
import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.model.FinalNode;
import com.tracker.hierarchy.model.HierarchyRequest;
import com.tracker.hierarchy.service.BatchHierarchyBuilder;
import com.tracker.hierarchy.service.HierarchySink;
import com.tracker.hierarchy.service.HierarchySource;
import com.tracker.hierarchy.service.MetricsCalculator;
import com.tracker.hierarchy.service.RelationshipCalculator;
import com.tracker.hierarchy.service.TraversalHierarchyBuilder;
import com.tracker.hierarchy.util.HierarchyValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Extraction service: build, annotate, validate, then hand the finished nodes to the sink.
 *
 * Builds run one at a time; the whole node list is finished in memory before the sink
 * sees any of it.
 */
@Slf4j
@Service
public class HierarchyServiceImpl {

    private final HierarchySource source;
    private final HierarchySink sink;
    private final HierarchyConfig config;
    private final Clock clock;

    public HierarchyServiceImpl(HierarchySource source, HierarchySink sink, HierarchyConfig config, Clock clock) {
        this.source = source;
        this.sink = sink;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Extract the hierarchy under one root and store it.
     *
     * @param request root and options; unset options come from configuration
     * @return statistics of the stored build
     * @throws IllegalArgumentException if the request is invalid
     * @throws com.tracker.hierarchy.service.RootNotFoundException if the root cannot be found
     * @throws com.tracker.hierarchy.service.FetchInterruptedException if the thread is interrupted mid-build
     */
    public synchronized ExtractionSummary extract(HierarchyRequest request) {
        long startTime = System.currentTimeMillis();

        ContainerLocator root = validateRoot(request);
        int maxDepth = request.getMaxDepth() != null ? request.getMaxDepth() : config.getMaxDepth();
        boolean includeClosed = request.getIncludeClosed() != null ? request.getIncludeClosed() : config.isIncludeClosed();
        BuildStrategy strategy = request.getStrategy() != null ? request.getStrategy() : config.getStrategy();
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }

        log.info("[Extract] ========================================");
        log.info("[Extract] root={}, strategy={}, maxDepth={}, includeClosed={}",
                root, strategy, maxDepth, includeClosed);

        // Phase 1: assemble
        BuildResult result = strategy == BuildStrategy.BATCH
                ? buildBatch(request, root, maxDepth, includeClosed)
                : new TraversalHierarchyBuilder(source).build(root, maxDepth, includeClosed);

        // Phase 2: relationships, Phase 3: metrics
        List<AnnotatedNode> annotated = new RelationshipCalculator().annotate(result.getNodes());
        List<FinalNode> finished = new MetricsCalculator(config.getCompletionScale())
                .annotate(annotated, OffsetDateTime.now(clock));

        // Phase 4: validate and store
        List<String> violations = HierarchyValidator.validate(finished);
        sink.upsertBatch(finished);

        ExtractionSummary summary = summarize(finished, strategy, result, violations.size());
        summary.setExecutionTimeMs(System.currentTimeMillis() - startTime);

        log.info("[Extract] done: {} item(s) ({} container(s), {} leaf item(s)), max depth {}, {} in {}ms",
                summary.getTotalItems(), summary.getContainerCount(), summary.getLeafItemCount(),
                summary.getMaxDepth(), result.getReport(), summary.getExecutionTimeMs());
        log.info("[Extract] ========================================");
        return summary;
    }

    /**
     * Finished nodes of a previously extracted root.
     */
    public List<FinalNode> getNodes(String rootId) {
        return sink.findByRoot(rootId);
    }

    private ContainerLocator validateRoot(HierarchyRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        if (request.getRootGroupId() <= 0 || request.getRootIid() <= 0) {
            throw new IllegalArgumentException("rootGroupId and rootIid must be positive");
        }
        return request.rootLocator();
    }

    private BuildResult buildBatch(HierarchyRequest request, ContainerLocator root, int maxDepth, boolean includeClosed) {
        List<Long> scope = new ArrayList<>(
                request.getScopeGroupIds() != null && !request.getScopeGroupIds().isEmpty()
                        ? request.getScopeGroupIds()
                        : config.getScopeGroupIds());
        if (!scope.contains(root.getGroupId())) {
            scope.add(root.getGroupId());
        }

        log.info("[Extract] fetching scope: groups={}", scope);
        List<FetchedNode> containers = source.getAllContainersInScope(scope);
        return new BatchHierarchyBuilder(source).build(containers, root, maxDepth, includeClosed);
    }

    private ExtractionSummary summarize(List<FinalNode> nodes, BuildStrategy strategy, BuildResult result,
                                        int violationCount) {
        ExtractionSummary summary = new ExtractionSummary();
        summary.setRootId(result.getRoot().getId());
        summary.setStrategy(strategy);
        summary.setTotalItems(nodes.size());
        summary.setReport(result.getReport());
        summary.setViolationCount(violationCount);

        int depthSum = 0;
        for (FinalNode node : nodes) {
            if (node.getNode().isContainer()) {
                summary.setContainerCount(summary.getContainerCount() + 1);
            } else {
                summary.setLeafItemCount(summary.getLeafItemCount() + 1);
            }
            if (node.getNode().isClosed()) {
                summary.setClosedCount(summary.getClosedCount() + 1);
            } else {
                summary.setOpenCount(summary.getOpenCount() + 1);
            }
            if (node.getAnnotated().isLeaf()) {
                summary.setLeafNodeCount(summary.getLeafNodeCount() + 1);
            }
            int depth = node.getPlaced().getDepth();
            summary.setMaxDepth(Math.max(summary.getMaxDepth(), depth));
            depthSum += depth;
        }
        summary.setAvgDepth(nodes.isEmpty() ? 0.0 : (double) depthSum / nodes.size());
        return summary;
    }
}

package com.tracker.hierarchy.service.impl;

import com.tracker.hierarchy.config.HierarchyConfig;
import com.tracker.hierarchy.model.BuildStrategy;
import com.tracker.hierarchy.model.ExtractionSummary;
import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.model.FinalNode;
import com.tracker.hierarchy.model.HierarchyRequest;
import com.tracker.hierarchy.model.NodeState;
import com.tracker.hierarchy.service.FakeHierarchySource;
import com.tracker.hierarchy.service.InMemoryHierarchySink;
import com.tracker.hierarchy.service.RootNotFoundException;
import com.tracker.hierarchy.util.HierarchyValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.tracker.hierarchy.service.TestNodes.GROUP;
import static com.tracker.hierarchy.service.TestNodes.container;
import static com.tracker.hierarchy.service.TestNodes.leaf;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end extraction over an in-memory source and sink
 */
public class HierarchyServiceImplTest {

    private static final Logger log = LoggerFactory.getLogger(HierarchyServiceImplTest.class);

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);

    private FakeHierarchySource source;
    private InMemoryHierarchySink sink;
    private HierarchyConfig config;
    private HierarchyServiceImpl service;

    /**
     * R -> (A -> closed issue, B)
     */
    @BeforeEach
    void setUp() {
        FetchedNode r = container(1, 1, null);
        FetchedNode a = container(2, 2, 1L);
        FetchedNode b = container(3, 3, 1L);
        source = spy(new FakeHierarchySource()
                .addContainer(r).addContainer(a).addContainer(b)
                .addLeaf(a, leaf(1, NodeState.CLOSED)));
        sink = new InMemoryHierarchySink();
        config = new HierarchyConfig();
        service = new HierarchyServiceImpl(source, sink, config, CLOCK);
    }

    @Test
    void test01_TraversalExtractionStoresFinishedNodes() {
        ExtractionSummary summary = service.extract(request(BuildStrategy.TRAVERSAL));
        log.info("summary: {} item(s), report {}", summary.getTotalItems(), summary.getReport());

        assertEquals("epic:10#1", summary.getRootId());
        assertEquals(4, summary.getTotalItems());
        assertEquals(3, summary.getContainerCount());
        assertEquals(1, summary.getLeafItemCount());
        assertEquals(3, summary.getOpenCount());
        assertEquals(1, summary.getClosedCount());
        assertEquals(2, summary.getMaxDepth());
        assertEquals(2, summary.getLeafNodeCount(), "B and the issue have no children");
        assertEquals(0, summary.getViolationCount());

        Map<String, FinalNode> stored = byId(service.getNodes("epic:10#1"));
        assertEquals(4, stored.size());
        assertEquals(2, stored.get("epic:10#1").getAnnotated().getChildCount());
        assertEquals(3, stored.get("epic:10#1").getAnnotated().getDescendantCount());
        assertEquals(Double.valueOf(0.0), stored.get("epic:10#1").getCompletionPct());
        assertEquals(Double.valueOf(100.0), stored.get("epic:10#2").getCompletionPct());
        assertNull(stored.get("epic:10#3").getCompletionPct());
        assertTrue(stored.get("epic:10#3").getAnnotated().isLeaf());
        assertEquals(Long.valueOf(5), stored.get("issue:77#1").getDaysToClose());
    }

    @Test
    void test02_BatchExtractionMatchesTraversal() {
        service.extract(request(BuildStrategy.TRAVERSAL));
        List<String> traversal = paths(service.getNodes("epic:10#1"));

        InMemoryHierarchySink batchSink = new InMemoryHierarchySink();
        HierarchyServiceImpl batchService = new HierarchyServiceImpl(source, batchSink, config, CLOCK);
        ExtractionSummary summary = batchService.extract(request(BuildStrategy.BATCH));

        assertEquals(traversal, paths(batchSink.findByRoot("epic:10#1")));
        assertEquals(0, summary.getReport().getOrphanedContainers());
    }

    @Test
    @SuppressWarnings("unchecked")
    void test03_BatchScopeAlwaysContainsRootGroup() {
        HierarchyRequest request = request(BuildStrategy.BATCH);
        request.setScopeGroupIds(Collections.singletonList(20L));

        service.extract(request);

        ArgumentCaptor<Collection<Long>> scope = ArgumentCaptor.forClass(Collection.class);
        verify(source).getAllContainersInScope(scope.capture());
        assertEquals(Arrays.asList(20L, GROUP), scope.getValue());
        verify(source, never()).getChildren(any());
    }

    @Test
    void test04_ConfigDefaultsApplyToUnsetOptions() {
        config.setIncludeClosed(false);

        HierarchyRequest request = new HierarchyRequest();
        request.setRootGroupId(GROUP);
        request.setRootIid(1);
        ExtractionSummary summary = service.extract(request);

        assertEquals(BuildStrategy.TRAVERSAL, summary.getStrategy());
        assertEquals(3, summary.getTotalItems(), "closed issue excluded");
        assertEquals(1, summary.getReport().getClosedLeavesExcluded());
        assertEquals(0, summary.getReport().getTruncatedContainers());

        config.setMaxDepth(1);
        ExtractionSummary shallow = service.extract(request);

        assertEquals(1, shallow.getMaxDepth());
        assertEquals(2, shallow.getReport().getTruncatedContainers(), "A and B sit at the limit");
    }

    @Test
    void test05_InvalidRequestsAreRejected() {
        HierarchyRequest noRoot = new HierarchyRequest();
        assertThrows(IllegalArgumentException.class, () -> service.extract(noRoot));

        HierarchyRequest negativeDepth = request(BuildStrategy.TRAVERSAL);
        negativeDepth.setMaxDepth(-1);
        assertThrows(IllegalArgumentException.class, () -> service.extract(negativeDepth));

        assertThrows(IllegalArgumentException.class, () -> service.extract(null));
        verifyNoInteractions(source);
    }

    @Test
    void test06_MissingRootStoresNothing() {
        HierarchyRequest request = request(BuildStrategy.TRAVERSAL);
        request.setRootIid(42);

        assertThrows(RootNotFoundException.class, () -> service.extract(request));
        assertTrue(sink.findByRoot("epic:10#42").isEmpty());
    }

    @Test
    void test07_ReExtractionReplacesStoredTree() {
        service.extract(request(BuildStrategy.TRAVERSAL));
        assertEquals(4, service.getNodes("epic:10#1").size());

        HierarchyRequest withoutClosed = request(BuildStrategy.TRAVERSAL);
        withoutClosed.setIncludeClosed(false);
        ExtractionSummary summary = service.extract(withoutClosed);

        List<FinalNode> stored = service.getNodes("epic:10#1");
        log.info("second build total={} stored={}", summary.getTotalItems(), stored.size());
        assertEquals(summary.getTotalItems(), stored.size(), "closed issue from the first build is gone");
        assertEquals(Collections.emptyList(), HierarchyValidator.validate(stored));
        assertNull(byId(stored).get("epic:10#2").getCompletionPct());
    }

    @Test
    void test08_OverlappingTreesAreStoredSeparately() {
        service.extract(request(BuildStrategy.TRAVERSAL));

        HierarchyRequest subtree = request(BuildStrategy.TRAVERSAL);
        subtree.setRootIid(2);
        service.extract(subtree);

        List<FinalNode> whole = service.getNodes("epic:10#1");
        List<FinalNode> part = service.getNodes("epic:10#2");
        assertEquals(4, whole.size());
        assertEquals(2, part.size());
        assertEquals(Collections.emptyList(), HierarchyValidator.validate(whole));
        assertEquals(Collections.emptyList(), HierarchyValidator.validate(part));
        assertEquals(1, byId(whole).get("epic:10#2").getPlaced().getDepth(), "epic 2 keeps its place in the outer tree");
    }

    private static HierarchyRequest request(BuildStrategy strategy) {
        HierarchyRequest request = new HierarchyRequest();
        request.setRootGroupId(GROUP);
        request.setRootIid(1);
        request.setMaxDepth(20);
        request.setIncludeClosed(true);
        request.setStrategy(strategy);
        return request;
    }

    private static Map<String, FinalNode> byId(List<FinalNode> nodes) {
        return nodes.stream().collect(Collectors.toMap(FinalNode::getId, Function.identity()));
    }

    private static List<String> paths(List<FinalNode> nodes) {
        return nodes.stream().map(n -> n.getPlaced().getHierarchyPath()).collect(Collectors.toList());
    }
}

package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.model.NodeIds;
import com.tracker.hierarchy.model.NodeState;
import com.tracker.hierarchy.model.NodeType;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Node factories shared by the engine tests.
 */
public final class TestNodes {

    public static final long GROUP = 10L;
    public static final long PROJECT = 77L;
    public static final OffsetDateTime CREATED = OffsetDateTime.of(2024, 1, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    private TestNodes() {
    }

    public static FetchedNode container(long iid, long internalId, Long parentInternalId) {
        return container(GROUP, iid, internalId, parentInternalId, NodeState.OPENED);
    }

    public static FetchedNode container(long groupId, long iid, long internalId, Long parentInternalId, NodeState state) {
        return FetchedNode.builder()
                .id(NodeIds.containerId(groupId, iid))
                .internalId(internalId)
                .iid(iid)
                .type(NodeType.CONTAINER)
                .parentInternalId(parentInternalId)
                .groupId(groupId)
                .title("Epic " + iid)
                .state(state)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .closedAt(state == NodeState.CLOSED ? CREATED.plusDays(3) : null)
                .build();
    }

    public static FetchedNode leaf(long iid, NodeState state) {
        return leaf(iid, state, null);
    }

    public static FetchedNode leaf(long iid, NodeState state, LocalDate dueDate) {
        return FetchedNode.builder()
                .id(NodeIds.leafId(PROJECT, iid))
                .internalId(100_000L + iid)
                .iid(iid)
                .type(NodeType.LEAF)
                .projectId(PROJECT)
                .title("Issue " + iid)
                .state(state)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .closedAt(state == NodeState.CLOSED ? CREATED.plusDays(5) : null)
                .dueDate(dueDate)
                .build();
    }
}

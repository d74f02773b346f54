package com.tracker.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;

/**
 * A work item exactly as the source returned it, before any hierarchy field is known.
 *
 * <p>{@code id} is the composite key used for output ({@code epic:group#iid} or
 * {@code issue:project#iid}); {@code internalId} is the tracker's numeric identity and is
 * only used to resolve {@code parentInternalId} links between containers.
 */
@Getter
@Builder
public class FetchedNode {
    private final String id;
    private final long internalId;
    private final long iid;
    private final NodeType type;

    /** Only set on containers. */
    private final Long parentInternalId;

    private final Long groupId;
    private final Long projectId;

    private final String title;
    private final NodeState state;
    private final String webUrl;
    private final String authorUsername;
    private final String assigneeUsername;
    private final Integer weight;

    @Builder.Default
    private final List<String> labels = Collections.emptyList();

    private final OffsetDateTime createdAt;
    private final OffsetDateTime updatedAt;
    private final OffsetDateTime closedAt;
    private final LocalDate dueDate;

    @JsonIgnore
    public boolean isContainer() {
        return type == NodeType.CONTAINER;
    }

    @JsonIgnore
    public boolean isClosed() {
        return state == NodeState.CLOSED;
    }

    @Override
    public String toString() {
        return id + "(" + internalId + ")";
    }
}

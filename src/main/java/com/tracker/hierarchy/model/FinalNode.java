package com.tracker.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Getter;

/**
 * The finished, immutable record handed to the sink.
 *
 * <p>Metric fields are null when they do not apply; {@code overdue} is always set.
 */
@Getter
public class FinalNode {
    @JsonUnwrapped
    private final AnnotatedNode annotated;

    private final Long daysOpen;
    private final Long daysToClose;
    private final boolean overdue;
    private final Long daysOverdue;
    private final Double completionPct;

    public FinalNode(AnnotatedNode annotated, Long daysOpen, Long daysToClose,
                     boolean overdue, Long daysOverdue, Double completionPct) {
        this.annotated = annotated;
        this.daysOpen = daysOpen;
        this.daysToClose = daysToClose;
        this.overdue = overdue;
        this.daysOverdue = daysOverdue;
        this.completionPct = completionPct;
    }

    @JsonIgnore
    public String getId() {
        return annotated.getId();
    }

    @JsonIgnore
    public FetchedNode getNode() {
        return annotated.getNode();
    }

    @JsonIgnore
    public PlacedNode getPlaced() {
        return annotated.getPlaced();
    }
}

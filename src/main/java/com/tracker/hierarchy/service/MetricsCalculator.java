package com.tracker.hierarchy.service;

import com.tracker.hierarchy.model.AnnotatedNode;
import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.model.FinalNode;
import com.tracker.hierarchy.model.NodeState;
import com.tracker.hierarchy.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Temporal and progress metrics per node.
 *
 * - daysOpen: whole days since creation, open nodes only
 * - daysToClose: whole days from creation to close
 * - overdue / daysOverdue: open nodes whose due date is before today
 * - completionPct: share of closed direct children, nodes with children only
 */
@Slf4j
public class MetricsCalculator {

    private final int completionScale;

    public MetricsCalculator(int completionScale) {
        this.completionScale = completionScale;
    }

    public List<FinalNode> annotate(List<AnnotatedNode> nodes, OffsetDateTime now) {
        log.info("[Metrics] calculating metrics for {} node(s) at {}", nodes.size(), now);

        Map<String, Integer> closedChildren = countClosedChildren(nodes);
        LocalDate today = now.toLocalDate();

        List<FinalNode> result = new ArrayList<>(nodes.size());
        int overdueCount = 0;
        for (AnnotatedNode node : nodes) {
            FetchedNode item = node.getNode();
            boolean open = item.getState() == NodeState.OPENED;

            Long daysOpen = null;
            if (open && item.getCreatedAt() != null) {
                daysOpen = TimeUtil.wholeDaysBetween(item.getCreatedAt(), now);
            }

            Long daysToClose = null;
            if (item.getClosedAt() != null && item.getCreatedAt() != null) {
                daysToClose = TimeUtil.wholeDaysBetween(item.getCreatedAt(), item.getClosedAt());
            }

            boolean overdue = open && item.getDueDate() != null && item.getDueDate().isBefore(today);
            Long daysOverdue = overdue ? TimeUtil.daysBetween(item.getDueDate(), today) : null;
            if (overdue) {
                overdueCount++;
            }

            result.add(new FinalNode(node, daysOpen, daysToClose, overdue, daysOverdue,
                    completionPct(node, closedChildren)));
        }

        log.info("[Metrics] done: {} overdue node(s)", overdueCount);
        return result;
    }

    private Double completionPct(AnnotatedNode node, Map<String, Integer> closedChildren) {
        if (node.getChildCount() == 0) {
            return null;
        }
        int closed = closedChildren.getOrDefault(node.getId(), 0);
        return BigDecimal.valueOf(100.0 * closed / node.getChildCount())
                .setScale(completionScale, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private Map<String, Integer> countClosedChildren(List<AnnotatedNode> nodes) {
        Map<String, Integer> closedChildren = new HashMap<>();
        for (AnnotatedNode node : nodes) {
            String parentId = node.getPlaced().getParentId();
            if (parentId != null && node.getNode().isClosed()) {
                closedChildren.merge(parentId, 1, Integer::sum);
            }
        }
        return closedChildren;
    }
}

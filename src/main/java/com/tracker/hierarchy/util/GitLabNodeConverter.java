package com.tracker.hierarchy.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracker.hierarchy.model.FetchedNode;
import com.tracker.hierarchy.model.NodeIds;
import com.tracker.hierarchy.model.NodeState;
import com.tracker.hierarchy.model.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts GitLab REST payloads (epics and issues) into {@link FetchedNode}s.
 */
public class GitLabNodeConverter {

    private GitLabNodeConverter() {
    }

    /**
     * Convert an epic payload.
     *
     * @param epic    JSON object from the epics API
     * @param groupId group the epic was listed from, used when the payload omits it
     * @return the container node, or null if the payload has no id
     */
    public static FetchedNode convertEpic(JsonNode epic, long groupId) {
        if (epic == null || !epic.hasNonNull("id") || !epic.hasNonNull("iid")) {
            return null;
        }

        long ownerGroup = epic.hasNonNull("group_id") ? epic.get("group_id").asLong() : groupId;
        long iid = epic.get("iid").asLong();

        return FetchedNode.builder()
                .id(NodeIds.containerId(ownerGroup, iid))
                .internalId(epic.get("id").asLong())
                .iid(iid)
                .type(NodeType.CONTAINER)
                .parentInternalId(getLongValue(epic, "parent_id"))
                .groupId(ownerGroup)
                .title(getStringValue(epic, "title"))
                .state(NodeState.fromCode(getStringValue(epic, "state")))
                .webUrl(getStringValue(epic, "web_url"))
                .authorUsername(getNestedString(epic, "author", "username"))
                .labels(getStringList(epic, "labels"))
                .createdAt(TimeUtil.parseDateTime(getStringValue(epic, "created_at")))
                .updatedAt(TimeUtil.parseDateTime(getStringValue(epic, "updated_at")))
                .closedAt(TimeUtil.parseDateTime(getStringValue(epic, "closed_at")))
                .dueDate(TimeUtil.parseDate(getStringValue(epic, "due_date")))
                .build();
    }

    /**
     * Convert an issue payload.
     *
     * @param issue JSON object from the epic issues API
     * @return the leaf node, or null if the payload has no id or project
     */
    public static FetchedNode convertIssue(JsonNode issue) {
        if (issue == null || !issue.hasNonNull("id") || !issue.hasNonNull("iid")
                || !issue.hasNonNull("project_id")) {
            return null;
        }

        long projectId = issue.get("project_id").asLong();
        long iid = issue.get("iid").asLong();

        return FetchedNode.builder()
                .id(NodeIds.leafId(projectId, iid))
                .internalId(issue.get("id").asLong())
                .iid(iid)
                .type(NodeType.LEAF)
                .projectId(projectId)
                .title(getStringValue(issue, "title"))
                .state(NodeState.fromCode(getStringValue(issue, "state")))
                .webUrl(getStringValue(issue, "web_url"))
                .authorUsername(getNestedString(issue, "author", "username"))
                .assigneeUsername(getNestedString(issue, "assignee", "username"))
                .weight(getIntegerValue(issue, "weight"))
                .labels(getStringList(issue, "labels"))
                .createdAt(TimeUtil.parseDateTime(getStringValue(issue, "created_at")))
                .updatedAt(TimeUtil.parseDateTime(getStringValue(issue, "updated_at")))
                .closedAt(TimeUtil.parseDateTime(getStringValue(issue, "closed_at")))
                .dueDate(TimeUtil.parseDate(getStringValue(issue, "due_date")))
                .build();
    }

    public static List<FetchedNode> convertEpicList(JsonNode array, long groupId) {
        List<FetchedNode> nodes = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return nodes;
        }
        for (JsonNode element : array) {
            FetchedNode node = convertEpic(element, groupId);
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    public static List<FetchedNode> convertIssueList(JsonNode array) {
        List<FetchedNode> nodes = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return nodes;
        }
        for (JsonNode element : array) {
            FetchedNode node = convertIssue(element);
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    private static String getStringValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static Long getLongValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : null;
    }

    private static Integer getIntegerValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    private static String getNestedString(JsonNode node, String object, String field) {
        JsonNode nested = node.get(object);
        return nested != null && nested.isObject() ? getStringValue(nested, field) : null;
    }

    private static List<String> getStringList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = node.get(field);
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                values.add(element.asText());
            }
        }
        return values;
    }
}

package com.tracker.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of work item in the hierarchy.
 */
public enum NodeType {
    CONTAINER("epic"),  // owns children (epic)
    LEAF("issue");      // terminates the hierarchy (issue)

    private final String code;

    NodeType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

package com.tracker.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Work item state as reported by the tracker.
 */
public enum NodeState {
    OPENED("opened"),
    CLOSED("closed");

    private final String code;

    NodeState(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Anything the tracker reports other than "closed" counts as open.
     */
    public static NodeState fromCode(String code) {
        return CLOSED.code.equalsIgnoreCase(code) ? CLOSED : OPENED;
    }
}

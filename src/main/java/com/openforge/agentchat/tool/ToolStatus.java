package com.openforge.agentchat.tool;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a single tool run.  Results handed back to callers are always
 * COMPLETED or FAILED; the other values appear only in progress reporting.
 */
public enum ToolStatus {

    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ToolStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

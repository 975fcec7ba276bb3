package com.openforge.agentchat.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a history entry, and the response type of a finished query
 * (ASSISTANT on success, ERROR when the pipeline aborted).
 */
public enum MessageType {

    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system"),
    TOOL_EXECUTION("tool_execution"),
    ERROR("error");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

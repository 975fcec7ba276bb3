package com.openforge.agentchat.tool;

import java.util.Map;

/** One entry of a batch handed to {@link ToolRegistry#executeMany}. */
public record ToolRequest(String toolName, Map<String, Object> parameters) {

    public ToolRequest {
        parameters = parameters == null ? Map.of() : parameters;
    }
}

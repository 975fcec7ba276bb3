package com.openforge.agentchat.tool;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Outcome of one tool run.
 *
 * A COMPLETED result carries a result map; a FAILED one carries a non-empty
 * error.  executionTime is wall-clock seconds and is stamped by the tool
 * wrapper, so it is present on every result that went through
 * {@link AgentTool#safeExecute}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        String toolName,
        ToolStatus status,
        Map<String, Object> result,
        String error,
        Double executionTime
) {

    public ToolResult {
        if (status == ToolStatus.FAILED && (error == null || error.isBlank())) {
            error = "Unknown error";
        }
    }

    public static ToolResult completed(String toolName, Map<String, Object> result) {
        return new ToolResult(toolName, ToolStatus.COMPLETED, result, null, null);
    }

    public static ToolResult failed(String toolName, String error) {
        return new ToolResult(toolName, ToolStatus.FAILED, null, error, null);
    }

    public ToolResult withExecutionTime(double seconds) {
        return new ToolResult(toolName, status, result, error, seconds);
    }

    public boolean succeeded() {
        return status == ToolStatus.COMPLETED;
    }
}

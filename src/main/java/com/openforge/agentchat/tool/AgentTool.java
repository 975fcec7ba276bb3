package com.openforge.agentchat.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Capability contract every tool implements.
 *
 * Implementations supply {@link #execute}, {@link #definition} and
 * {@link #validateParameters}.  Callers never invoke execute() directly: they
 * go through {@link #safeExecute}, which validates, times the run, turns any
 * exception into a FAILED result and reports start/finish progress.
 *
 * Every AgentTool bean in the context is picked up by {@link ToolRegistry}.
 */
public interface AgentTool {

    String name();

    String description();

    String category();

    /** Must agree with {@link #validateParameters}. */
    ToolDefinition definition();

    /** Rejects anything {@link #execute} cannot safely consume. */
    boolean validateParameters(Map<String, Object> parameters);

    /**
     * Tool-specific logic.  May throw; the wrapper converts the exception into
     * a FAILED result.  The returned result's executionTime is overwritten.
     *
     * @param progress sink for intermediate progress, never null
     */
    ToolResult execute(Map<String, Object> parameters, ToolProgressListener progress) throws Exception;

    boolean isEnabled();

    void enable();

    void disable();

    /** Listener used by {@link #safeExecute(Map)}; {@link ToolProgressListener#NOOP} when none is attached. */
    ToolProgressListener progressListener();

    void setProgressListener(ToolProgressListener listener);

    default List<String> requiredParameters() {
        return definition().requiredParams();
    }

    default ToolResult safeExecute(Map<String, Object> parameters) {
        return safeExecute(parameters, progressListener());
    }

    /**
     * Validate, run and time this tool.  Never throws.
     *
     * @param listener per-call progress sink; takes precedence over the attached one
     */
    default ToolResult safeExecute(Map<String, Object> parameters, ToolProgressListener listener) {
        Logger log = LoggerFactory.getLogger(getClass());
        ToolProgressListener progress = listener != null ? listener : ToolProgressListener.NOOP;
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        long start = System.nanoTime();

        ToolResult result;
        if (!validateParameters(params)) {
            log.debug("[Tool] {} rejected parameters {}", name(), params.keySet());
            result = ToolResult.failed(name(), "Invalid parameters provided");
        } else {
            reportProgress(progress, "Starting " + name() + "...", 0.0);
            try {
                result = execute(params, progress);
                if (result == null) {
                    result = ToolResult.failed(name(), "Tool returned no result");
                }
            } catch (Exception e) {
                log.warn("[Tool] {} threw {}: {}", name(), e.getClass().getSimpleName(), e.getMessage());
                result = ToolResult.failed(name(), "Tool execution failed: " + e.getMessage());
            }
            if (result.succeeded()) {
                reportProgress(progress, name() + " completed successfully", 1.0);
            } else {
                reportProgress(progress, name() + " failed: " + result.error(), 0.0);
            }
        }
        return result.withExecutionTime((System.nanoTime() - start) / 1_000_000_000.0);
    }

    private void reportProgress(ToolProgressListener listener, String message, double progress) {
        try {
            listener.onProgress(message, progress);
        } catch (Exception e) {
            LoggerFactory.getLogger(getClass())
                    .warn("[Tool] Progress listener for {} failed: {}", name(), e.getMessage());
        }
    }
}

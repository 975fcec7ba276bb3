package com.openforge.agentchat.tool;

/**
 * Receives progress notifications from a running tool.
 * progress is a fraction in [0, 1].
 */
@FunctionalInterface
public interface ToolProgressListener {

    ToolProgressListener NOOP = (message, progress) -> { };

    void onProgress(String message, double progress);
}

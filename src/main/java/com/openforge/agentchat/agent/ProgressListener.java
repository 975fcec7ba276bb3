package com.openforge.agentchat.agent;

/**
 * Receives pipeline checkpoints.  Delivery is best-effort: an exception
 * thrown here is logged by the orchestrator and otherwise ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = update -> { };

    void onProgress(ProgressUpdate update);
}

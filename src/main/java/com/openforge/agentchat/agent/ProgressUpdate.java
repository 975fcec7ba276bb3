package com.openforge.agentchat.agent;

/**
 * @param progress fraction in [0, 1]
 */
public record ProgressUpdate(String message, double progress, String sessionId) {}

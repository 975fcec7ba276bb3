package com.openforge.agentchat.session;

import java.time.Instant;

/**
 * @param messageCount       queries received on the session
 * @param conversationLength history entries, user and assistant alike
 * @param lastActivity       timestamp of the newest history entry, null when empty
 */
public record SessionStats(
        String sessionId,
        Instant createdAt,
        int messageCount,
        int conversationLength,
        Instant lastActivity
) {}

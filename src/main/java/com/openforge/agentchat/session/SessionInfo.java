package com.openforge.agentchat.session;

import java.time.Instant;

/** Session metadata as of the moment it was read. */
public record SessionInfo(String sessionId, Instant createdAt, int messageCount) {}

package com.openforge.agentchat.intent;

import java.time.Instant;

/** One history entry as shown to the classifier. */
public record ConversationTurn(String role, String content, Instant timestamp) {}

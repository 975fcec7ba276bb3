package com.openforge.agentchat.agent.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Incoming chat query.  A missing sessionId starts a new session.
 * context is accepted for API compatibility and not used by the pipeline.
 */
public record UserQuery(
        @NotBlank String message,
        String sessionId,
        String userId,
        Map<String, Object> context
) {

    public static UserQuery of(String message, String sessionId) {
        return new UserQuery(message, sessionId, null, null);
    }
}
